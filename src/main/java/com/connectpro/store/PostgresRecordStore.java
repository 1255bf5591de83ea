package com.connectpro.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.connectpro.shared.model.Conversation;
import com.connectpro.shared.model.Message;
import com.connectpro.shared.model.MessageKind;
import com.connectpro.shared.model.OnboardingStep;
import com.connectpro.shared.model.Owner;
import com.connectpro.shared.model.OwnerMode;
import com.connectpro.shared.model.OwnerStats;
import com.connectpro.shared.model.OwnerUpdate;
import com.connectpro.shared.model.SenderRole;
import com.connectpro.shared.model.User;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.Date;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public class PostgresRecordStore implements RecordStore {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<Map<String, String>> METADATA_TYPE = new TypeReference<>() {};

    private final DataSource dataSource;
    private final int queryTimeoutSeconds;
    private final Clock clock;

    public PostgresRecordStore(DataSource dataSource, Duration queryTimeout, Clock clock) {
        this.dataSource = dataSource;
        this.queryTimeoutSeconds = (int) Math.max(1, queryTimeout.toSeconds());
        this.clock = clock;
    }

    @Override
    public User upsertUser(long id, String username, String displayName) {
        var sql = """
            INSERT INTO users (telegram_id, username, first_name)
            VALUES (?, ?, ?)
            ON CONFLICT (telegram_id) DO UPDATE SET
                username = EXCLUDED.username,
                first_name = EXCLUDED.first_name,
                last_active = CURRENT_TIMESTAMP
            RETURNING *
            """;
        try (var conn = dataSource.getConnection();
             var ps = prepare(conn, sql)) {
            ps.setLong(1, id);
            ps.setString(2, username);
            ps.setString(3, displayName);
            try (var rs = ps.executeQuery()) {
                rs.next();
                return mapUser(rs);
            }
        } catch (SQLException e) {
            throw StoreException.from(e, "Failed to upsert user: " + id);
        }
    }

    @Override
    public Optional<Owner> getOwner(long id) {
        try (var conn = dataSource.getConnection();
             var ps = prepare(conn, "SELECT * FROM owners WHERE telegram_id = ?")) {
            ps.setLong(1, id);
            try (var rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(mapOwner(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw StoreException.from(e, "Failed to load owner: " + id);
        }
    }

    @Override
    public Owner upsertOwner(long id, String username, OwnerMode mode) {
        var sql = """
            INSERT INTO owners (telegram_id, username, mode, trial_start)
            VALUES (?, ?, ?, ?)
            ON CONFLICT (telegram_id) DO UPDATE SET
                mode = EXCLUDED.mode,
                trial_start = CASE WHEN EXCLUDED.mode = 'DEDICATED_CHANNEL'
                                   THEN COALESCE(owners.trial_start, EXCLUDED.trial_start)
                                   ELSE NULL END
            RETURNING *
            """;
        try (var conn = dataSource.getConnection();
             var ps = prepare(conn, sql)) {
            ps.setLong(1, id);
            ps.setString(2, username);
            ps.setString(3, mode.name());
            if (mode == OwnerMode.DEDICATED_CHANNEL) {
                ps.setTimestamp(4, Timestamp.from(clock.instant()));
            } else {
                ps.setNull(4, Types.TIMESTAMP);
            }
            try (var rs = ps.executeQuery()) {
                rs.next();
                return mapOwner(rs);
            }
        } catch (SQLException e) {
            throw StoreException.from(e, "Failed to upsert owner: " + id);
        }
    }

    @Override
    public Optional<Owner> updateOwner(long id, OwnerUpdate delta) {
        if (delta.isEmpty()) return getOwner(id);

        var columns = new ArrayList<String>();
        var values = new ArrayList<Object>();
        addColumn(columns, values, "business_name", delta.businessName());
        addColumn(columns, values, "category", delta.category());
        addColumn(columns, values, "bio", delta.bio());
        addColumn(columns, values, "logo_file_id", delta.logoRef());
        addColumn(columns, values, "mode", delta.mode() != null ? delta.mode().name() : null);
        addColumn(columns, values, "bot_token", delta.credential());
        addColumn(columns, values, "bot_username", delta.botUsername());
        addColumn(columns, values, "is_active", delta.active());
        addColumn(columns, values, "onboarding_step",
                delta.onboardingStep() != null ? delta.onboardingStep().name() : null);

        var sets = new StringBuilder();
        for (var column : columns) {
            if (sets.length() > 0) sets.append(", ");
            sets.append(column).append(" = ?");
        }
        if (delta.mode() == OwnerMode.DEDICATED_CHANNEL) {
            sets.append(", trial_start = COALESCE(trial_start, ?)");
            values.add(Timestamp.from(clock.instant()));
        } else if (delta.mode() == OwnerMode.SHARED_FRONT_DOOR) {
            sets.append(", trial_start = NULL");
        }

        var sql = "UPDATE owners SET " + sets + " WHERE telegram_id = ? RETURNING *";
        try (var conn = dataSource.getConnection();
             var ps = prepare(conn, sql)) {
            int i = 1;
            for (var value : values) {
                ps.setObject(i++, value);
            }
            ps.setLong(i, id);
            try (var rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(mapOwner(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw StoreException.from(e, "Failed to update owner: " + id);
        }
    }

    @Override
    public List<Owner> listOwners() {
        return queryOwners("SELECT * FROM owners ORDER BY created_at DESC");
    }

    @Override
    public List<Owner> listActiveDedicatedOwners() {
        return queryOwners("""
            SELECT * FROM owners
            WHERE mode = 'DEDICATED_CHANNEL'
            AND bot_token IS NOT NULL
            AND is_active = TRUE
            AND trial_expired = FALSE
            """);
    }

    private List<Owner> queryOwners(String sql) {
        try (var conn = dataSource.getConnection();
             var ps = prepare(conn, sql);
             var rs = ps.executeQuery()) {
            var owners = new ArrayList<Owner>();
            while (rs.next()) {
                owners.add(mapOwner(rs));
            }
            return owners;
        } catch (SQLException e) {
            throw StoreException.from(e, "Failed to list owners");
        }
    }

    @Override
    public Optional<Conversation> findConversation(long userId, long ownerId) {
        try (var conn = dataSource.getConnection();
             var ps = prepare(conn, "SELECT * FROM conversations WHERE user_id = ? AND owner_id = ?")) {
            ps.setLong(1, userId);
            ps.setLong(2, ownerId);
            try (var rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(mapConversation(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw StoreException.from(e, "Failed to load conversation " + userId + "/" + ownerId);
        }
    }

    @Override
    public Conversation getOrCreateConversation(long userId, long ownerId) {
        var sql = """
            INSERT INTO conversations (user_id, owner_id, last_message_date)
            VALUES (?, ?, ?)
            ON CONFLICT (user_id, owner_id) DO UPDATE SET
                last_message = CURRENT_TIMESTAMP
            RETURNING *
            """;
        try (var conn = dataSource.getConnection();
             var ps = prepare(conn, sql)) {
            ps.setLong(1, userId);
            ps.setLong(2, ownerId);
            ps.setDate(3, Date.valueOf(LocalDate.now(clock)));
            try (var rs = ps.executeQuery()) {
                rs.next();
                return mapConversation(rs);
            }
        } catch (SQLException e) {
            var failure = StoreException.from(e, "Failed to upsert conversation " + userId + "/" + ownerId);
            if (failure.reason() == StoreException.Reason.CONSTRAINT_VIOLATION) {
                // lost a race on the pairing key: the row exists now
                return findConversation(userId, ownerId).orElseThrow(() -> failure);
            }
            throw failure;
        }
    }

    @Override
    public Message appendMessage(long conversationId, SenderRole role, String text, MessageKind kind, Long originId,
                                 Map<String, String> metadata) {
        var sql = """
            INSERT INTO messages (conversation_id, sender_type, message_text, message_type, origin_message_id, metadata)
            VALUES (?, ?, ?, ?, ?, ?::jsonb)
            RETURNING *
            """;
        try (var conn = dataSource.getConnection();
             var ps = prepare(conn, sql)) {
            ps.setLong(1, conversationId);
            ps.setString(2, role.name().toLowerCase());
            ps.setString(3, text);
            ps.setString(4, kind.name().toLowerCase());
            if (originId != null) {
                ps.setLong(5, originId);
            } else {
                ps.setNull(5, Types.BIGINT);
            }
            ps.setString(6, metadata == null || metadata.isEmpty() ? null : MAPPER.writeValueAsString(metadata));
            try (var rs = ps.executeQuery()) {
                rs.next();
                return mapMessage(rs);
            }
        } catch (SQLException e) {
            throw StoreException.from(e, "Failed to append message to conversation " + conversationId);
        } catch (JsonProcessingException e) {
            throw new StoreException(StoreException.Reason.FAILURE, "Unserializable message metadata", e);
        }
    }

    @Override
    public List<Message> recentUserMessages(long ownerId, int limit) {
        var sql = """
            SELECT m.* FROM messages m
            JOIN conversations c ON m.conversation_id = c.id
            WHERE c.owner_id = ? AND m.sender_type = 'user'
            ORDER BY m.id DESC
            LIMIT ?
            """;
        try (var conn = dataSource.getConnection();
             var ps = prepare(conn, sql)) {
            ps.setLong(1, ownerId);
            ps.setInt(2, limit);
            try (var rs = ps.executeQuery()) {
                var result = new ArrayList<Message>();
                while (rs.next()) {
                    result.add(mapMessage(rs));
                }
                return result;
            }
        } catch (SQLException e) {
            throw StoreException.from(e, "Failed to load recent messages for owner " + ownerId);
        }
    }

    @Override
    public void recordForward(long messageId, String channel, long forwardMessageId) {
        try (var conn = dataSource.getConnection();
             var ps = prepare(conn,
                     "UPDATE messages SET forward_channel = ?, forward_message_id = ? WHERE id = ?")) {
            ps.setString(1, channel);
            ps.setLong(2, forwardMessageId);
            ps.setLong(3, messageId);
            ps.executeUpdate();
        } catch (SQLException e) {
            throw StoreException.from(e, "Failed to record forward for message " + messageId);
        }
    }

    @Override
    public Optional<Conversation> findConversationByForward(long ownerId, String channel, long forwardMessageId) {
        var sql = """
            SELECT c.* FROM conversations c
            JOIN messages m ON m.conversation_id = c.id
            WHERE c.owner_id = ? AND m.forward_channel = ? AND m.forward_message_id = ?
            ORDER BY m.id DESC
            LIMIT 1
            """;
        try (var conn = dataSource.getConnection();
             var ps = prepare(conn, sql)) {
            ps.setLong(1, ownerId);
            ps.setString(2, channel);
            ps.setLong(3, forwardMessageId);
            try (var rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(mapConversation(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw StoreException.from(e, "Failed to resolve forward " + forwardMessageId + " for owner " + ownerId);
        }
    }

    @Override
    public QuotaResult tryConsumeDailyQuota(long userId, long ownerId, int cap, LocalDate today) {
        var sql = """
            UPDATE conversations SET
                message_count_today = CASE WHEN last_message_date = ? THEN message_count_today + 1 ELSE 1 END,
                last_message_date = ?,
                last_message = CURRENT_TIMESTAMP
            WHERE user_id = ? AND owner_id = ?
            AND (last_message_date IS DISTINCT FROM ? OR message_count_today < ?)
            """;
        var day = Date.valueOf(today);
        try (var conn = dataSource.getConnection();
             var ps = prepare(conn, sql)) {
            ps.setDate(1, day);
            ps.setDate(2, day);
            ps.setLong(3, userId);
            ps.setLong(4, ownerId);
            ps.setDate(5, day);
            ps.setInt(6, cap);
            return ps.executeUpdate() == 1 ? QuotaResult.ALLOWED : QuotaResult.DENIED;
        } catch (SQLException e) {
            throw StoreException.from(e, "Failed to consume quota " + userId + "/" + ownerId);
        }
    }

    @Override
    public boolean markTrialExpired(long ownerId) {
        try (var conn = dataSource.getConnection();
             var ps = prepare(conn, "UPDATE owners SET trial_expired = TRUE WHERE telegram_id = ? AND trial_expired = FALSE")) {
            ps.setLong(1, ownerId);
            return ps.executeUpdate() == 1;
        } catch (SQLException e) {
            throw StoreException.from(e, "Failed to mark trial expired: " + ownerId);
        }
    }

    @Override
    public long purgeMessagesOlderThan(Duration retention) {
        var cutoff = clock.instant().minus(retention);
        try (var conn = dataSource.getConnection();
             var ps = prepare(conn, "DELETE FROM messages WHERE created_at < ?")) {
            ps.setTimestamp(1, Timestamp.from(cutoff));
            return ps.executeUpdate();
        } catch (SQLException e) {
            throw StoreException.from(e, "Failed to purge messages older than " + cutoff);
        }
    }

    @Override
    public OwnerStats ownerStats(long ownerId) {
        var sql = """
            SELECT
                (SELECT COUNT(DISTINCT user_id) FROM conversations WHERE owner_id = ?),
                (SELECT COUNT(*) FROM messages m JOIN conversations c ON m.conversation_id = c.id WHERE c.owner_id = ?)
            """;
        try (var conn = dataSource.getConnection();
             var ps = prepare(conn, sql)) {
            ps.setLong(1, ownerId);
            ps.setLong(2, ownerId);
            try (var rs = ps.executeQuery()) {
                if (rs.next()) {
                    return new OwnerStats(rs.getLong(1), rs.getLong(2));
                }
                return new OwnerStats(0, 0);
            }
        } catch (SQLException e) {
            throw StoreException.from(e, "Failed to load stats for owner " + ownerId);
        }
    }

    private PreparedStatement prepare(Connection conn, String sql) throws SQLException {
        var ps = conn.prepareStatement(sql);
        ps.setQueryTimeout(queryTimeoutSeconds);
        return ps;
    }

    private static void addColumn(List<String> columns, List<Object> values, String column, Object value) {
        if (value != null) {
            columns.add(column);
            values.add(value);
        }
    }

    private static User mapUser(ResultSet rs) throws SQLException {
        return new User(
                rs.getLong("telegram_id"),
                rs.getString("username"),
                rs.getString("first_name"),
                instant(rs.getTimestamp("created_at")),
                instant(rs.getTimestamp("last_active")));
    }

    private static Owner mapOwner(ResultSet rs) throws SQLException {
        var step = rs.getString("onboarding_step");
        return new Owner(
                rs.getLong("telegram_id"),
                rs.getString("username"),
                rs.getString("business_name"),
                rs.getString("category"),
                rs.getString("bio"),
                rs.getString("logo_file_id"),
                OwnerMode.valueOf(rs.getString("mode")),
                rs.getString("bot_token"),
                rs.getString("bot_username"),
                instant(rs.getTimestamp("trial_start")),
                rs.getBoolean("trial_expired"),
                rs.getBoolean("is_active"),
                step != null ? OnboardingStep.valueOf(step) : null,
                instant(rs.getTimestamp("created_at")));
    }

    private static Conversation mapConversation(ResultSet rs) throws SQLException {
        var date = rs.getDate("last_message_date");
        return new Conversation(
                rs.getLong("id"),
                rs.getLong("user_id"),
                rs.getLong("owner_id"),
                rs.getInt("message_count_today"),
                date != null ? date.toLocalDate() : null,
                instant(rs.getTimestamp("last_message")),
                instant(rs.getTimestamp("created_at")));
    }

    private static Message mapMessage(ResultSet rs) throws SQLException {
        var origin = rs.getLong("origin_message_id");
        var originId = rs.wasNull() ? null : origin;
        var metadata = rs.getString("metadata");
        Map<String, String> extra;
        try {
            extra = metadata != null ? MAPPER.readValue(metadata, METADATA_TYPE) : Map.of();
        } catch (JsonProcessingException e) {
            throw new StoreException(StoreException.Reason.FAILURE, "Corrupt metadata on message " + rs.getLong("id"), e);
        }
        return new Message(
                rs.getLong("id"),
                rs.getLong("conversation_id"),
                SenderRole.valueOf(rs.getString("sender_type").toUpperCase()),
                rs.getString("message_text"),
                MessageKind.valueOf(rs.getString("message_type").toUpperCase()),
                originId,
                extra,
                instant(rs.getTimestamp("created_at")));
    }

    private static Instant instant(Timestamp ts) {
        return ts != null ? ts.toInstant() : null;
    }
}
