package gov.pmis.budget_ledger.ledger.store;

import gov.pmis.budget_ledger.exception.ConflictException;
import gov.pmis.budget_ledger.exception.NotFoundException;
import gov.pmis.budget_ledger.ledger.BudgetCategory;
import gov.pmis.budget_ledger.ledger.BudgetLine;
import gov.pmis.budget_ledger.ledger.BudgetLineStatus;
import gov.pmis.budget_ledger.persistence.LockRetryTemplate;
import gov.pmis.budget_ledger.transaction.BudgetTransaction;
import gov.pmis.budget_ledger.transaction.TransactionStatus;
import gov.pmis.budget_ledger.transaction.TransactionType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Date;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * PostgreSQL ledger store on plain JDBC.
 *
 * The per-line lock is a {@code SELECT ... FOR UPDATE} on the budget_lines row,
 * held until the surrounding transaction ends. Derived amounts are always summed
 * from budget_transactions; nothing is cached on the line row.
 */
@Repository
@Slf4j
public class JdbcLedgerStore implements LedgerStore {

    private static final String LINE_COLUMNS =
        "id, project_id, category, fiscal_year, allocated_amount, alert_threshold_percent, status, " +
        "start_date, end_date, notes, allocated_by, created_at, updated_at";

    private static final String TRANSACTION_COLUMNS =
        "id, budget_line_id, transaction_type, amount, description, vendor_id, status, transaction_date, " +
        "created_by, decided_by, decision_comment, created_at, decided_at";

    private final JdbcTemplate jdbcTemplate;
    private final LockRetryTemplate lockRetryTemplate;

    public JdbcLedgerStore(JdbcTemplate jdbcTemplate, LockRetryTemplate lockRetryTemplate) {
        this.jdbcTemplate = jdbcTemplate;
        this.lockRetryTemplate = lockRetryTemplate;
    }

    @Override
    public BudgetLine insertLine(BudgetLine line) {
        try {
            jdbcTemplate.update(
                "INSERT INTO budget_lines (" + LINE_COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)",
                line.getId(),
                line.getProjectId(),
                line.getCategory().name(),
                line.getFiscalYear(),
                line.getAllocatedAmount(),
                line.getAlertThresholdPercent(),
                line.getStatus().name(),
                toDate(line.getStartDate()),
                toDate(line.getEndDate()),
                line.getNotes(),
                line.getAllocatedBy(),
                toTimestamp(line.getCreatedAt()),
                toTimestamp(line.getUpdatedAt())
            );
        } catch (DuplicateKeyException e) {
            throw new ConflictException(
                String.format("Budget line already exists for project %s, category %s, fiscal year %d",
                    line.getProjectId(), line.getCategory(), line.getFiscalYear()),
                Map.of("projectId", line.getProjectId().toString(),
                    "category", line.getCategory().name(),
                    "fiscalYear", line.getFiscalYear()));
        }
        return line;
    }

    @Override
    public Optional<BudgetLine> findLine(UUID lineId) {
        return jdbcTemplate.query(
            "SELECT " + LINE_COLUMNS + " FROM budget_lines WHERE id = ?",
            budgetLineRowMapper(),
            lineId
        ).stream().findFirst();
    }

    @Override
    public List<BudgetLine> findLines(BudgetLineQuery query) {
        StringBuilder sql = new StringBuilder("SELECT " + LINE_COLUMNS + " FROM budget_lines WHERE 1 = 1");
        List<Object> params = new ArrayList<>();
        if (query.getProjectId() != null) {
            sql.append(" AND project_id = ?");
            params.add(query.getProjectId());
        }
        if (query.getFiscalYear() != null) {
            sql.append(" AND fiscal_year = ?");
            params.add(query.getFiscalYear());
        }
        if (query.getStatus() != null) {
            sql.append(" AND status = ?");
            params.add(query.getStatus().name());
        }
        sql.append(" ORDER BY fiscal_year, project_id, category");

        return jdbcTemplate.query(sql.toString(), budgetLineRowMapper(), params.toArray());
    }

    @Override
    public BudgetLine updateLine(BudgetLine line) {
        int updated = jdbcTemplate.update(
            "UPDATE budget_lines SET allocated_amount = ?, alert_threshold_percent = ?, status = ?, " +
            "updated_at = ? WHERE id = ?",
            line.getAllocatedAmount(),
            line.getAlertThresholdPercent(),
            line.getStatus().name(),
            toTimestamp(line.getUpdatedAt()),
            line.getId()
        );
        if (updated == 0) {
            throw new NotFoundException("Budget line", line.getId());
        }
        return line;
    }

    @Override
    public void deleteLine(UUID lineId) {
        jdbcTemplate.update("DELETE FROM budget_lines WHERE id = ?", lineId);
    }

    @Override
    public <T> T inLineLock(UUID lineId, Supplier<T> work) {
        return lockRetryTemplate.execute(lineId, status -> {
            List<UUID> locked = jdbcTemplate.query(
                "SELECT id FROM budget_lines WHERE id = ? FOR UPDATE",
                (rs, rowNum) -> UUID.fromString(rs.getString("id")),
                lineId
            );
            if (locked.isEmpty()) {
                throw new NotFoundException("Budget line", lineId);
            }
            return work.get();
        });
    }

    @Override
    public BudgetTransaction insertTransaction(BudgetTransaction transaction, String idempotencyKey) {
        try {
            jdbcTemplate.update(
                "INSERT INTO budget_transactions (" + TRANSACTION_COLUMNS + ", idempotency_key) " +
                "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)",
                transaction.getId(),
                transaction.getBudgetLineId(),
                transaction.getType().name(),
                transaction.getAmount(),
                transaction.getDescription(),
                transaction.getVendorId(),
                transaction.getStatus().name(),
                toDate(transaction.getTransactionDate()),
                transaction.getCreatedBy(),
                transaction.getDecidedBy(),
                transaction.getDecisionComment(),
                toTimestamp(transaction.getCreatedAt()),
                toTimestamp(transaction.getDecidedAt()),
                idempotencyKey
            );
        } catch (DuplicateKeyException e) {
            log.warn("Idempotency key collision on insert: key={}", idempotencyKey);
            throw new ConflictException("Idempotency key already used: " + idempotencyKey);
        }
        return transaction;
    }

    @Override
    public Optional<BudgetTransaction> findTransaction(UUID transactionId) {
        return jdbcTemplate.query(
            "SELECT " + TRANSACTION_COLUMNS + " FROM budget_transactions WHERE id = ?",
            transactionRowMapper(),
            transactionId
        ).stream().findFirst();
    }

    @Override
    public Optional<BudgetTransaction> findTransactionByIdempotencyKey(String idempotencyKey) {
        return jdbcTemplate.query(
            "SELECT " + TRANSACTION_COLUMNS + " FROM budget_transactions WHERE idempotency_key = ?",
            transactionRowMapper(),
            idempotencyKey
        ).stream().findFirst();
    }

    @Override
    public List<BudgetTransaction> findTransactions(UUID lineId, TransactionStatus status, TransactionType type) {
        StringBuilder sql = new StringBuilder(
            "SELECT " + TRANSACTION_COLUMNS + " FROM budget_transactions WHERE budget_line_id = ?");
        List<Object> params = new ArrayList<>();
        params.add(lineId);
        if (status != null) {
            sql.append(" AND status = ?");
            params.add(status.name());
        }
        if (type != null) {
            sql.append(" AND transaction_type = ?");
            params.add(type.name());
        }
        sql.append(" ORDER BY created_at, id");

        return jdbcTemplate.query(sql.toString(), transactionRowMapper(), params.toArray());
    }

    @Override
    public BudgetTransaction updateTransaction(BudgetTransaction transaction) {
        int updated = jdbcTemplate.update(
            "UPDATE budget_transactions SET status = ?, decided_by = ?, decision_comment = ?, decided_at = ? " +
            "WHERE id = ?",
            transaction.getStatus().name(),
            transaction.getDecidedBy(),
            transaction.getDecisionComment(),
            toTimestamp(transaction.getDecidedAt()),
            transaction.getId()
        );
        if (updated == 0) {
            throw new NotFoundException(BudgetTransaction.RESOURCE, transaction.getId());
        }
        return transaction;
    }

    @Override
    public LedgerTotals totals(UUID lineId) {
        return jdbcTemplate.queryForObject(
            "SELECT " +
            "  COALESCE(SUM(CASE WHEN status = 'APPROVED' AND transaction_type IN ('EXPENSE', 'COMMITMENT') " +
            "    THEN amount END), 0) AS approved_debits, " +
            "  COALESCE(SUM(CASE WHEN status = 'APPROVED' AND transaction_type IN ('REFUND', 'ADJUSTMENT') " +
            "    THEN amount END), 0) AS approved_credits, " +
            "  COALESCE(SUM(CASE WHEN status = 'PENDING' AND transaction_type IN ('EXPENSE', 'COMMITMENT') " +
            "    THEN amount END), 0) AS pending_debits, " +
            "  COUNT(*) AS transaction_count " +
            "FROM budget_transactions WHERE budget_line_id = ?",
            (rs, rowNum) -> LedgerTotals.of(
                rs.getBigDecimal("approved_debits"),
                rs.getBigDecimal("approved_credits"),
                rs.getBigDecimal("pending_debits"),
                rs.getLong("transaction_count")
            ),
            lineId
        );
    }

    private RowMapper<BudgetLine> budgetLineRowMapper() {
        return (rs, rowNum) -> new BudgetLine(
            UUID.fromString(rs.getString("id")),
            UUID.fromString(rs.getString("project_id")),
            BudgetCategory.valueOf(rs.getString("category")),
            rs.getInt("fiscal_year"),
            rs.getBigDecimal("allocated_amount"),
            rs.getInt("alert_threshold_percent"),
            BudgetLineStatus.valueOf(rs.getString("status")),
            toLocalDate(rs.getDate("start_date")),
            toLocalDate(rs.getDate("end_date")),
            rs.getString("notes"),
            toUuid(rs, "allocated_by"),
            toInstant(rs.getTimestamp("created_at")),
            toInstant(rs.getTimestamp("updated_at"))
        );
    }

    private RowMapper<BudgetTransaction> transactionRowMapper() {
        return (rs, rowNum) -> new BudgetTransaction(
            UUID.fromString(rs.getString("id")),
            UUID.fromString(rs.getString("budget_line_id")),
            TransactionType.valueOf(rs.getString("transaction_type")),
            rs.getBigDecimal("amount"),
            rs.getString("description"),
            toUuid(rs, "vendor_id"),
            TransactionStatus.valueOf(rs.getString("status")),
            toLocalDate(rs.getDate("transaction_date")),
            toUuid(rs, "created_by"),
            toUuid(rs, "decided_by"),
            rs.getString("decision_comment"),
            toInstant(rs.getTimestamp("created_at")),
            toInstant(rs.getTimestamp("decided_at"))
        );
    }

    private static UUID toUuid(ResultSet rs, String column) throws SQLException {
        String value = rs.getString(column);
        return value != null ? UUID.fromString(value) : null;
    }

    private static Timestamp toTimestamp(Instant instant) {
        return instant != null ? Timestamp.from(instant) : null;
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp != null ? timestamp.toInstant() : null;
    }

    private static Date toDate(LocalDate date) {
        return date != null ? Date.valueOf(date) : null;
    }

    private static LocalDate toLocalDate(Date date) {
        return date != null ? date.toLocalDate() : null;
    }
}
