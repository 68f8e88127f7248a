package io.chatgate.core.session;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.chatgate.core.model.MessageRole;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public final class SqliteConversationStore implements ConversationStore {
    private static final TypeReference<List<String>> IMAGE_URIS = new TypeReference<>() {
    };

    private final String jdbcUrl;
    private final ObjectMapper mapper;
    private long lastSequence;

    public SqliteConversationStore(Path dbPath) throws IOException {
        if (dbPath == null) {
            throw new IllegalArgumentException("dbPath must not be null");
        }
        Files.createDirectories(dbPath.toAbsolutePath().getParent());
        this.jdbcUrl = "jdbc:sqlite:" + dbPath.toAbsolutePath();
        this.mapper = new ObjectMapper();
        init();
    }

    @Override
    public synchronized Conversation create(String title, String modelProvider, String modelName) throws IOException {
        Conversation conversation = new Conversation(
            UUID.randomUUID().toString(),
            title,
            modelProvider,
            modelName,
            Instant.now()
        );
        String sql = """
            INSERT INTO conversations (id, title, model_provider, model_name, created_at)
            VALUES (?, ?, ?, ?, ?)
            """;
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, conversation.id());
            statement.setString(2, conversation.title());
            statement.setString(3, conversation.modelProvider());
            statement.setString(4, conversation.modelName());
            statement.setString(5, conversation.createdAt().toString());
            statement.executeUpdate();
            return conversation;
        } catch (SQLException e) {
            throw new IOException("Failed to create conversation", e);
        }
    }

    @Override
    public synchronized Optional<Conversation> find(String conversationId) throws IOException {
        String sql = """
            SELECT id, title, model_provider, model_name, created_at
            FROM conversations
            WHERE id = ?
            """;
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, conversationId);
            try (ResultSet resultSet = statement.executeQuery()) {
                return resultSet.next() ? Optional.of(readConversation(resultSet)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new IOException("Failed to load conversation " + conversationId, e);
        }
    }

    @Override
    public synchronized List<Conversation> list(int offset, int limit) throws IOException {
        String sql = """
            SELECT id, title, model_provider, model_name, created_at
            FROM conversations
            ORDER BY rowid DESC
            LIMIT ? OFFSET ?
            """;
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setInt(1, Math.max(0, limit));
            statement.setInt(2, Math.max(0, offset));
            try (ResultSet resultSet = statement.executeQuery()) {
                List<Conversation> conversations = new ArrayList<>();
                while (resultSet.next()) {
                    conversations.add(readConversation(resultSet));
                }
                return conversations;
            }
        } catch (SQLException e) {
            throw new IOException("Failed to list conversations", e);
        }
    }

    @Override
    public synchronized int count() throws IOException {
        try (Connection connection = openConnection();
             Statement statement = connection.createStatement();
             ResultSet resultSet = statement.executeQuery("SELECT COUNT(*) FROM conversations")) {
            return resultSet.next() ? resultSet.getInt(1) : 0;
        } catch (SQLException e) {
            throw new IOException("Failed to count conversations", e);
        }
    }

    @Override
    public synchronized Optional<Conversation> update(Conversation conversation) throws IOException {
        String sql = """
            UPDATE conversations
            SET title = ?, model_provider = ?, model_name = ?
            WHERE id = ?
            """;
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, conversation.title());
            statement.setString(2, conversation.modelProvider());
            statement.setString(3, conversation.modelName());
            statement.setString(4, conversation.id());
            if (statement.executeUpdate() == 0) {
                return Optional.empty();
            }
        } catch (SQLException e) {
            throw new IOException("Failed to update conversation " + conversation.id(), e);
        }
        return find(conversation.id());
    }

    @Override
    public synchronized boolean delete(String conversationId) throws IOException {
        try (Connection connection = openConnection()) {
            connection.setAutoCommit(false);
            try (PreparedStatement messages = connection.prepareStatement("DELETE FROM messages WHERE conversation_id = ?");
                 PreparedStatement conversation = connection.prepareStatement("DELETE FROM conversations WHERE id = ?")) {
                messages.setString(1, conversationId);
                messages.executeUpdate();
                conversation.setString(1, conversationId);
                int deleted = conversation.executeUpdate();
                connection.commit();
                return deleted > 0;
            } catch (SQLException e) {
                connection.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new IOException("Failed to delete conversation " + conversationId, e);
        }
    }

    @Override
    public synchronized List<StoredMessage> messages(String conversationId) throws IOException {
        String sql = """
            SELECT id, conversation_id, role, content, model_name, images_json, created_at
            FROM messages
            WHERE conversation_id = ?
            ORDER BY seq ASC
            """;
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, conversationId);
            try (ResultSet resultSet = statement.executeQuery()) {
                List<StoredMessage> messages = new ArrayList<>();
                while (resultSet.next()) {
                    messages.add(readMessage(resultSet));
                }
                return messages;
            }
        } catch (SQLException e) {
            throw new IOException("Failed to list messages for conversation " + conversationId, e);
        }
    }

    @Override
    public synchronized StoredMessage append(
        String conversationId,
        MessageRole role,
        String content,
        String modelName,
        List<String> images
    ) throws IOException {
        if (find(conversationId).isEmpty()) {
            throw new IllegalArgumentException("Unknown conversation: " + conversationId);
        }
        StoredMessage message = new StoredMessage(
            UUID.randomUUID().toString(),
            conversationId,
            role,
            content,
            modelName,
            images,
            Instant.now()
        );
        String sql = """
            INSERT INTO messages (id, seq, conversation_id, role, content, model_name, images_json, created_at)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?)
            """;
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            connection.setAutoCommit(false);
            statement.setString(1, message.id());
            statement.setLong(2, nextSequence());
            statement.setString(3, message.conversationId());
            statement.setString(4, message.role().wireValue());
            statement.setString(5, message.content());
            statement.setString(6, message.modelName());
            statement.setString(7, message.hasImages() ? mapper.writeValueAsString(message.images()) : null);
            statement.setString(8, message.createdAt().toString());
            statement.executeUpdate();
            connection.commit();
            return message;
        } catch (SQLException e) {
            throw new IOException("Failed to append message to conversation " + conversationId, e);
        }
    }

    @Override
    public synchronized Optional<StoredMessage> findMessage(String messageId) throws IOException {
        String sql = """
            SELECT id, conversation_id, role, content, model_name, images_json, created_at
            FROM messages
            WHERE id = ?
            """;
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, messageId);
            try (ResultSet resultSet = statement.executeQuery()) {
                return resultSet.next() ? Optional.of(readMessage(resultSet)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new IOException("Failed to load message " + messageId, e);
        }
    }

    @Override
    public synchronized Optional<StoredMessage> updateMessage(String messageId, String content, String modelName)
        throws IOException {
        String sql = """
            UPDATE messages
            SET content = ?, model_name = ?
            WHERE id = ?
            """;
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, content == null ? "" : content);
            statement.setString(2, modelName);
            statement.setString(3, messageId);
            if (statement.executeUpdate() == 0) {
                return Optional.empty();
            }
        } catch (SQLException e) {
            throw new IOException("Failed to update message " + messageId, e);
        }
        return findMessage(messageId);
    }

    @Override
    public synchronized boolean deleteMessage(String messageId) throws IOException {
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement("DELETE FROM messages WHERE id = ?")) {
            statement.setString(1, messageId);
            return statement.executeUpdate() > 0;
        } catch (SQLException e) {
            throw new IOException("Failed to delete message " + messageId, e);
        }
    }

    private static Conversation readConversation(ResultSet resultSet) throws SQLException {
        return new Conversation(
            resultSet.getString("id"),
            resultSet.getString("title"),
            resultSet.getString("model_provider"),
            resultSet.getString("model_name"),
            Instant.parse(resultSet.getString("created_at"))
        );
    }

    private StoredMessage readMessage(ResultSet resultSet) throws SQLException, IOException {
        String imagesJson = resultSet.getString("images_json");
        List<String> images = imagesJson == null || imagesJson.isBlank()
            ? List.of()
            : mapper.readValue(imagesJson, IMAGE_URIS);
        return new StoredMessage(
            resultSet.getString("id"),
            resultSet.getString("conversation_id"),
            MessageRole.fromWire(resultSet.getString("role")),
            resultSet.getString("content"),
            resultSet.getString("model_name"),
            images,
            Instant.parse(resultSet.getString("created_at"))
        );
    }

    // Timestamps can collide within a millisecond; ordering relies on this counter instead.
    private long nextSequence() {
        long candidate = System.currentTimeMillis() * 1000;
        lastSequence = Math.max(candidate, lastSequence + 1);
        return lastSequence;
    }

    private Connection openConnection() throws SQLException {
        Connection connection = DriverManager.getConnection(jdbcUrl);
        try (Statement statement = connection.createStatement()) {
            statement.execute("PRAGMA journal_mode=WAL;");
            statement.execute("PRAGMA synchronous=NORMAL;");
        }
        return connection;
    }

    private void init() throws IOException {
        String conversations = """
            CREATE TABLE IF NOT EXISTS conversations (
                id TEXT PRIMARY KEY,
                title TEXT NOT NULL,
                model_provider TEXT NOT NULL,
                model_name TEXT NOT NULL,
                created_at TEXT NOT NULL
            )
            """;
        String messages = """
            CREATE TABLE IF NOT EXISTS messages (
                id TEXT PRIMARY KEY,
                seq INTEGER NOT NULL,
                conversation_id TEXT NOT NULL REFERENCES conversations(id),
                role TEXT NOT NULL,
                content TEXT NOT NULL,
                model_name TEXT,
                images_json TEXT,
                created_at TEXT NOT NULL
            )
            """;
        String idx = """
            CREATE INDEX IF NOT EXISTS idx_messages_conversation_seq
            ON messages(conversation_id, seq)
            """;
        try (Connection connection = openConnection();
             Statement statement = connection.createStatement()) {
            statement.execute(conversations);
            statement.execute(messages);
            statement.execute(idx);
            try (ResultSet resultSet = statement.executeQuery("SELECT COALESCE(MAX(seq), 0) FROM messages")) {
                if (resultSet.next()) {
                    lastSequence = resultSet.getLong(1);
                }
            }
        } catch (SQLException e) {
            throw new IOException("Failed to initialize SQLite conversation store", e);
        }
    }
}
