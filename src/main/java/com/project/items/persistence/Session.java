package com.project.items.persistence;

import com.project.items.model.Item;
import org.springframework.dao.EmptyResultDataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;

import java.sql.PreparedStatement;
import java.util.List;
import java.util.Optional;

/**
 * One unit of work against the {@code items} table. Only valid inside the
 * {@link SessionFactory#inSession} callback that created it; every statement
 * runs on that callback's transaction.
 */
public class Session {

    private static final String INSERT = "INSERT INTO items (name, description) VALUES (?, ?)";
    private static final String SELECT_BY_ID = "SELECT " + ItemRowMapper.COLUMNS + " FROM items WHERE id = ?";
    private static final String SELECT_PAGE =
            "SELECT " + ItemRowMapper.COLUMNS + " FROM items ORDER BY id LIMIT ? OFFSET ?";
    private static final String DELETE_BY_ID = "DELETE FROM items WHERE id = ?";

    private static final ItemRowMapper ROW_MAPPER = new ItemRowMapper();

    private final JdbcTemplate jdbc;
    private boolean open = true;

    Session(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    /** Inserts a row and reads it back with the store-generated id and timestamps. */
    public Item insert(String name, String description) {
        ensureOpen();
        KeyHolder keys = new GeneratedKeyHolder();
        jdbc.update(con -> {
            PreparedStatement ps = con.prepareStatement(INSERT, new String[] {"id"});
            ps.setString(1, name);
            ps.setString(2, description);
            return ps;
        }, keys);

        Number id = keys.getKey();
        if (id == null) {
            throw new EmptyResultDataAccessException("No generated id returned for insert", 1);
        }
        return findById(id.longValue())
                .orElseThrow(() -> new EmptyResultDataAccessException("Inserted item " + id + " not readable", 1));
    }

    public List<Item> findAll(int skip, int limit) {
        ensureOpen();
        return jdbc.query(SELECT_PAGE, ROW_MAPPER, limit, skip);
    }

    public Optional<Item> findById(long id) {
        ensureOpen();
        return jdbc.query(SELECT_BY_ID, ROW_MAPPER, id).stream().findFirst();
    }

    /** @return true when a row was removed */
    public boolean delete(long id) {
        ensureOpen();
        return jdbc.update(DELETE_BY_ID, id) > 0;
    }

    /** Liveness probe. */
    public void ping() {
        ensureOpen();
        jdbc.queryForObject("SELECT 1", Integer.class);
    }

    void close() {
        open = false;
    }

    private void ensureOpen() {
        if (!open) {
            throw new IllegalStateException("Session used outside of its scope");
        }
    }
}
