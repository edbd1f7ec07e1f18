package com.guno.orderpipeline.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.guno.orderpipeline.entity.Order;
import com.guno.orderpipeline.exception.PipelineException;
import com.guno.orderpipeline.exception.StoreUnavailableException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Canonical order store on PostgreSQL - one JSONB payload per order_id.
 * Upsert replaces the payload wholesale.
 */
@RequiredArgsConstructor
@Slf4j
public class JdbcOrderStore implements KeyedStore<Order> {

    private static final String CREATE_SQL = """
        CREATE TABLE IF NOT EXISTS tbl_canonical_order (
            seq BIGSERIAL,
            order_id TEXT PRIMARY KEY,
            payload JSONB NOT NULL,
            updated_at TIMESTAMPTZ NOT NULL DEFAULT now()
        )
        """;

    private static final String UPSERT_SQL = """
        INSERT INTO tbl_canonical_order (order_id, payload, updated_at)
        VALUES (?, ?::jsonb, now())
        ON CONFLICT (order_id) DO UPDATE SET payload = EXCLUDED.payload, updated_at = EXCLUDED.updated_at
        """;

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    public void ensureTable() {
        execute("ensureTable", () -> {
            jdbcTemplate.execute(CREATE_SQL);
            return null;
        });
        log.info("Canonical order table ready");
    }

    @Override
    public Optional<Order> findById(String key) {
        List<Order> found = execute("findById", () -> jdbcTemplate.query(
                "SELECT payload FROM tbl_canonical_order WHERE order_id = ?", orderRowMapper(), key));
        return found.stream().findFirst();
    }

    @Override
    public void put(String key, Order value) {
        String payload = toJson(value);
        execute("put", () -> jdbcTemplate.update(UPSERT_SQL, key, payload));
    }

    @Override
    public boolean deleteById(String key) {
        int deleted = execute("deleteById",
                () -> jdbcTemplate.update("DELETE FROM tbl_canonical_order WHERE order_id = ?", key));
        return deleted > 0;
    }

    @Override
    public List<Order> findAll() {
        return execute("findAll", () -> jdbcTemplate.query(
                "SELECT payload FROM tbl_canonical_order ORDER BY seq", orderRowMapper()));
    }

    @Override
    public long count() {
        Long count = execute("count",
                () -> jdbcTemplate.queryForObject("SELECT COUNT(*) FROM tbl_canonical_order", Long.class));
        return count == null ? 0 : count;
    }

    private RowMapper<Order> orderRowMapper() {
        return (rs, rowNum) -> fromJson(rs.getString("payload"));
    }

    private String toJson(Order order) {
        try {
            return objectMapper.writeValueAsString(order);
        } catch (JsonProcessingException e) {
            throw new PipelineException("Cannot serialize order " + order.getOrderId(), e);
        }
    }

    private Order fromJson(String payload) {
        try {
            return objectMapper.readValue(payload, Order.class);
        } catch (JsonProcessingException e) {
            throw new PipelineException("Cannot read stored order payload", e);
        }
    }

    private <T> T execute(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (TransientDataAccessException | DataAccessResourceFailureException | RecoverableDataAccessException e) {
            throw new StoreUnavailableException("Order store unavailable during " + operation, e);
        }
    }
}
