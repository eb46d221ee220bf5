package gov.pmis.budget_ledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class BudgetLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(BudgetLedgerApplication.class, args);
    }
}
