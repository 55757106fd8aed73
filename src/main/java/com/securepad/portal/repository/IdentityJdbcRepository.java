package com.securepad.portal.repository;

import com.securepad.portal.identity.IdentityModels.UserAccount;
import com.securepad.portal.identity.Role;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public class IdentityJdbcRepository {
    private static final String USER_COLUMNS = "id, handle, email, role, created_at";
    private static final RowMapper<UserAccount> USER_MAPPER = (rs, n) -> new UserAccount(
            rs.getString(1), rs.getString(2), rs.getString(3),
            Role.valueOf(rs.getString(4)), Instant.parse(rs.getString(5)));

    private final JdbcTemplate jdbcTemplate;

    public IdentityJdbcRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public void insertUser(UserAccount user) {
        jdbcTemplate.update(
                "INSERT INTO users(" + USER_COLUMNS + ") VALUES (?,?,?,?,?)",
                user.id(), user.handle(), user.email(), user.role().name(), user.createdAt().toString());
    }

    public Optional<UserAccount> findUser(String id) {
        return first(jdbcTemplate.query("SELECT " + USER_COLUMNS + " FROM users WHERE id=?", USER_MAPPER, id));
    }

    public Optional<UserAccount> findUserByHandle(String handle) {
        return first(jdbcTemplate.query("SELECT " + USER_COLUMNS + " FROM users WHERE handle=?", USER_MAPPER, handle));
    }

    public boolean existsHandleOrEmail(String handle, String email) {
        Long value = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM users WHERE handle=? OR email=?", Long.class, handle, email);
        return value != null && value > 0;
    }

    public void insertToken(TokenRow token) {
        jdbcTemplate.update(
                "INSERT INTO access_tokens(token, user_id, issued_at, expires_at) VALUES (?,?,?,?)",
                token.token(), token.userId(), token.issuedAt().toString(), token.expiresAt().toString());
    }

    public Optional<TokenRow> findToken(String token) {
        return first(jdbcTemplate.query(
                "SELECT token, user_id, issued_at, expires_at FROM access_tokens WHERE token=?",
                (rs, n) -> new TokenRow(rs.getString(1), rs.getString(2), Instant.parse(rs.getString(3)), Instant.parse(rs.getString(4))),
                token));
    }

    private static <T> Optional<T> first(List<T> rows) {
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    public record TokenRow(String token, String userId, Instant issuedAt, Instant expiresAt) {}
}
