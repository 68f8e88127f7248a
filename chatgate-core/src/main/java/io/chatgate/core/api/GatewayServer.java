package io.chatgate.core.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.chatgate.core.model.GenerationResult;
import io.chatgate.core.model.MessageRole;
import io.chatgate.core.model.StreamEvent;
import io.chatgate.core.model.Turn;
import io.chatgate.core.provider.AiGateway;
import io.chatgate.core.provider.GatewayException;
import io.chatgate.core.provider.ProviderRegistry;
import io.chatgate.core.session.Conversation;
import io.chatgate.core.session.ConversationHistory;
import io.chatgate.core.session.ConversationStore;
import io.chatgate.core.session.StoredMessage;
import io.chatgate.core.stream.GenerationStream;
import io.undertow.Handlers;
import io.undertow.Undertow;
import io.undertow.server.HttpServerExchange;
import io.undertow.server.handlers.PathHandler;
import io.undertow.server.handlers.form.FormData;
import io.undertow.server.handlers.form.FormDataParser;
import io.undertow.server.handlers.form.FormParserFactory;
import io.undertow.server.handlers.form.MultiPartParserDefinition;
import io.undertow.util.Headers;
import io.undertow.util.HttpString;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.math.BigInteger;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.URLConnection;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.security.MessageDigest;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * HTTP front of the gateway: model catalogue, conversations and their messages. Replies to a new
 * message are streamed as server-sent events unless the request sets {@code stream} to false.
 */
public final class GatewayServer implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(GatewayServer.class);
    private static final HttpString CORS_ALLOW_ORIGIN = new HttpString("Access-Control-Allow-Origin");
    private static final HttpString CORS_ALLOW_METHODS = new HttpString("Access-Control-Allow-Methods");
    private static final HttpString CORS_ALLOW_HEADERS = new HttpString("Access-Control-Allow-Headers");
    private static final HttpString CORS_MAX_AGE = new HttpString("Access-Control-Max-Age");
    private static final HttpString ACCEL_BUFFERING = new HttpString("X-Accel-Buffering");
    private static final int CONVERSATIONS_PER_PAGE = 20;
    private static final int MESSAGES_PER_PAGE = 50;

    private final ObjectMapper mapper;
    private final String host;
    private final int requestedPort;
    private final String apiToken;
    private final AiGateway gateway;
    private final ConversationStore store;

    private final AtomicBoolean running;
    private Undertow server;
    private int actualPort;

    public GatewayServer(int port, AiGateway gateway, ConversationStore store) {
        this(port, "0.0.0.0", "", gateway, store);
    }

    public GatewayServer(int port, String host, String apiToken, AiGateway gateway, ConversationStore store) {
        this.requestedPort = port;
        this.host = host == null || host.isBlank() ? "0.0.0.0" : host;
        this.apiToken = apiToken == null ? "" : apiToken.trim();
        this.gateway = Objects.requireNonNull(gateway, "gateway must not be null");
        this.store = Objects.requireNonNull(store, "store must not be null");

        this.mapper = new ObjectMapper();
        this.mapper.registerModule(new JavaTimeModule());
        this.mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.running = new AtomicBoolean(false);
    }

    public void start() {
        if (running.getAndSet(true)) {
            return;
        }

        PathHandler routes = Handlers.path()
            .addExactPath("/healthz", this::handleHealth)
            .addExactPath("/chat/models", this::handleModels)
            .addExactPath("/chat/health", this::handleProviderHealth)
            .addPrefixPath("/conversations", exchange -> handleApi(exchange, this::routeConversations))
            .addPrefixPath("/messages", exchange -> handleApi(exchange, this::routeMessages));

        server = Undertow.builder()
            .addHttpListener(requestedPort, host)
            .setHandler(exchange -> handleWithCors(routes, exchange))
            .build();
        server.start();
        this.actualPort = resolveBoundPort(server, requestedPort);
        LOG.info("Gateway server listening on {}:{}", host, actualPort);
    }

    public int port() {
        return actualPort;
    }

    @Override
    public void close() {
        running.set(false);
        if (server != null) {
            server.stop();
            server = null;
        }
    }

    private void handleWithCors(PathHandler routes, HttpServerExchange exchange) throws Exception {
        applyCorsHeaders(exchange);
        if ("OPTIONS".equalsIgnoreCase(exchange.getRequestMethod().toString())) {
            exchange.setStatusCode(204);
            exchange.endExchange();
            return;
        }
        if (!"/healthz".equals(exchange.getRequestPath()) && !authorized(exchange)) {
            sendJson(exchange, 401, Map.of("error", "unauthorized"));
            return;
        }
        routes.handleRequest(exchange);
    }

    private boolean authorized(HttpServerExchange exchange) {
        if (apiToken.isEmpty()) {
            return true;
        }
        String expected = "Bearer " + apiToken;
        String actual = header(exchange, "Authorization").trim();
        return MessageDigest.isEqual(
            expected.getBytes(StandardCharsets.UTF_8),
            actual.getBytes(StandardCharsets.UTF_8)
        );
    }

    private void applyCorsHeaders(HttpServerExchange exchange) {
        String origin = header(exchange, "Origin");
        if (origin.isBlank() || !isAllowedCorsOrigin(origin)) {
            return;
        }
        exchange.getResponseHeaders().put(CORS_ALLOW_ORIGIN, origin);
        exchange.getResponseHeaders().put(CORS_ALLOW_METHODS, "GET,POST,OPTIONS");
        exchange.getResponseHeaders().put(CORS_ALLOW_HEADERS, "Content-Type,Authorization");
        exchange.getResponseHeaders().put(CORS_MAX_AGE, "86400");
        exchange.getResponseHeaders().put(Headers.VARY, "Origin");
    }

    private boolean isAllowedCorsOrigin(String origin) {
        try {
            URI uri = URI.create(origin);
            String scheme = uri.getScheme();
            String hostName = uri.getHost();
            if (scheme == null || hostName == null) {
                return false;
            }
            return ("http".equalsIgnoreCase(scheme) || "https".equalsIgnoreCase(scheme))
                && ("localhost".equalsIgnoreCase(hostName) || "127.0.0.1".equals(hostName));
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    private void handleHealth(HttpServerExchange exchange) throws IOException {
        if (!isMethod(exchange, "GET")) {
            sendJson(exchange, 405, Map.of("error", "method_not_allowed"));
            return;
        }
        sendJson(exchange, 200, Map.of("status", "ok"));
    }

    private void handleModels(HttpServerExchange exchange) throws IOException {
        if (!isMethod(exchange, "GET")) {
            sendJson(exchange, 405, Map.of("error", "method_not_allowed"));
            return;
        }
        ProviderRegistry registry = gateway.registry();
        Map<String, Object> models = new LinkedHashMap<>();
        for (String provider : registry.listProviders()) {
            models.put(provider, registry.listModelAliases(provider));
        }
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("providers", registry.listProviders());
        data.put("models", models);
        sendJson(exchange, 200, Map.of("data", data));
    }

    private void handleProviderHealth(HttpServerExchange exchange) throws IOException {
        if (!isMethod(exchange, "GET")) {
            sendJson(exchange, 405, Map.of("error", "method_not_allowed"));
            return;
        }
        ProviderRegistry registry = gateway.registry();
        Map<String, Object> status = new LinkedHashMap<>();
        for (String provider : registry.listProviders()) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("available", true);
            entry.put("models", registry.listModelAliases(provider));
            entry.put("status", "operational");
            status.put(provider, entry);
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("data", status);
        payload.put("timestamp", Instant.now());
        sendJson(exchange, 200, payload);
    }

    private void handleApi(HttpServerExchange exchange, ApiHandler handler) throws Exception {
        if (exchange.isInIoThread()) {
            exchange.dispatch(() -> {
                try {
                    handleApi(exchange, handler);
                } catch (Exception e) {
                    sendInternalError(exchange, e);
                }
            });
            return;
        }

        try {
            handler.handle(exchange, pathSegments(exchange.getRelativePath()));
        } catch (JsonProcessingException e) {
            sendJson(exchange, 400, Map.of("error", "invalid_json"));
        } catch (RequestValidationException e) {
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("message", e.getMessage());
            payload.put("errors", e.errors());
            sendJson(exchange, 422, payload);
        } catch (GatewayException e) {
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("message", "Failed to generate AI response");
            payload.put("error", e.getMessage());
            sendJson(exchange, ErrorStatus.forKind(e.kind()), payload);
        }
    }

    private void routeConversations(HttpServerExchange exchange, List<String> segments) throws Exception {
        if (segments.isEmpty()) {
            if (isMethod(exchange, "GET")) {
                listConversations(exchange);
            } else if (isMethod(exchange, "POST")) {
                createConversation(exchange);
            } else {
                sendJson(exchange, 405, Map.of("error", "method_not_allowed"));
            }
            return;
        }
        if (segments.size() == 1 && "start".equals(segments.get(0)) && isMethod(exchange, "POST")) {
            startConversation(exchange);
            return;
        }
        if (segments.size() == 1 && "models".equals(segments.get(0)) && isMethod(exchange, "GET")) {
            handleModels(exchange);
            return;
        }
        if (segments.size() > 2 || (segments.size() == 2 && !"messages".equals(segments.get(1)))) {
            sendJson(exchange, 404, Map.of("error", "not_found"));
            return;
        }

        Optional<Conversation> conversation = store.find(segments.get(0));
        if (conversation.isEmpty()) {
            sendJson(exchange, 404, Map.of("message", "Conversation not found"));
            return;
        }
        if (segments.size() == 2) {
            if (isMethod(exchange, "GET")) {
                listMessages(exchange, conversation.get());
            } else if (isMethod(exchange, "POST")) {
                postMessage(exchange, conversation.get());
            } else {
                sendJson(exchange, 405, Map.of("error", "method_not_allowed"));
            }
            return;
        }
        if (isMethod(exchange, "GET")) {
            showConversation(exchange, conversation.get());
        } else if (isMethod(exchange, "PUT") || isMethod(exchange, "PATCH")) {
            updateConversation(exchange, conversation.get());
        } else if (isMethod(exchange, "DELETE")) {
            store.delete(conversation.get().id());
            LOG.debug("Deleted conversation id={}", conversation.get().id());
            sendJson(exchange, 200, Map.of("message", "Conversation deleted successfully"));
        } else {
            sendJson(exchange, 405, Map.of("error", "method_not_allowed"));
        }
    }

    private void routeMessages(HttpServerExchange exchange, List<String> segments) throws Exception {
        if (segments.isEmpty()) {
            if (!isMethod(exchange, "GET")) {
                sendJson(exchange, 405, Map.of("error", "method_not_allowed"));
                return;
            }
            listMessagesByQuery(exchange);
            return;
        }
        if (segments.size() != 1) {
            sendJson(exchange, 404, Map.of("error", "not_found"));
            return;
        }
        Optional<StoredMessage> message = store.findMessage(segments.get(0));
        if (message.isEmpty()) {
            sendJson(exchange, 404, Map.of("message", "Message not found"));
            return;
        }
        if (isMethod(exchange, "GET")) {
            sendJson(exchange, 200, Map.of("data", messagePayload(message.get())));
        } else if (isMethod(exchange, "PUT") || isMethod(exchange, "PATCH")) {
            UpdateMessageRequest request = UpdateMessageRequest.from(readJsonBody(exchange));
            StoredMessage existing = message.get();
            Optional<StoredMessage> updated = store.updateMessage(
                existing.id(),
                request.contentFor(existing),
                request.modelNameFor(existing)
            );
            if (updated.isEmpty()) {
                sendJson(exchange, 404, Map.of("message", "Message not found"));
                return;
            }
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("message", "Message updated successfully");
            payload.put("data", messagePayload(updated.get()));
            sendJson(exchange, 200, payload);
        } else if (isMethod(exchange, "DELETE")) {
            store.deleteMessage(message.get().id());
            sendJson(exchange, 200, Map.of("message", "Message deleted successfully"));
        } else {
            sendJson(exchange, 405, Map.of("error", "method_not_allowed"));
        }
    }

    private void listConversations(HttpServerExchange exchange) throws IOException {
        int page = parseQueryInt(exchange, "page", 1, 1, Integer.MAX_VALUE);
        int total = store.count();
        List<Map<String, Object>> data = new ArrayList<>();
        for (Conversation conversation : store.list(offset(page, CONVERSATIONS_PER_PAGE), CONVERSATIONS_PER_PAGE)) {
            List<StoredMessage> messages = store.messages(conversation.id());
            Map<String, Object> item = conversationPayload(conversation);
            item.put("messages_count", messages.size());
            item.put("latest_message", messages.isEmpty() ? null : messagePayload(messages.get(messages.size() - 1)));
            data.add(item);
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("data", data);
        payload.put("meta", pageMeta(page, CONVERSATIONS_PER_PAGE, total));
        sendJson(exchange, 200, payload);
    }

    private void createConversation(HttpServerExchange exchange) throws IOException {
        CreateConversationRequest request = CreateConversationRequest.from(readJsonBody(exchange));
        Conversation conversation = store.create(request.title(), request.modelProvider(), request.modelName());
        LOG.debug(
            "Created conversation id={} provider={} model={}",
            conversation.id(),
            conversation.modelProvider(),
            conversation.modelName()
        );
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("message", "Conversation created successfully");
        payload.put("data", conversationPayload(conversation));
        sendJson(exchange, 201, payload);
    }

    private void startConversation(HttpServerExchange exchange) throws IOException {
        StartConversationRequest request = StartConversationRequest.from(readJsonBody(exchange));
        CreateConversationRequest fields = request.conversation();
        Conversation conversation = store.create(fields.title(), fields.modelProvider(), fields.modelName());
        store.append(conversation.id(), MessageRole.USER, request.content(), null, List.of());

        GenerationResult result;
        try {
            result = gateway.generate(
                conversation.modelProvider(),
                conversation.modelName(),
                List.of(Turn.user(request.content())),
                request.options()
            );
        } catch (GatewayException e) {
            store.delete(conversation.id());
            LOG.warn("Failed to start conversation provider={} model={}: {}",
                conversation.modelProvider(), conversation.modelName(), e.getMessage());
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("message", "Failed to start conversation");
            payload.put("error", e.getMessage());
            sendJson(exchange, ErrorStatus.forKind(e.kind()), payload);
            return;
        }
        store.append(conversation.id(), MessageRole.ASSISTANT, result.content(), result.model(), List.of());

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("conversation", conversationWithMessages(conversation));
        data.put("usage", result.hasUsage() ? result.usage() : null);
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("message", "Conversation started successfully");
        payload.put("data", data);
        sendJson(exchange, 201, payload);
    }

    private void showConversation(HttpServerExchange exchange, Conversation conversation) throws IOException {
        sendJson(exchange, 200, Map.of("data", conversationWithMessages(conversation)));
    }

    private void updateConversation(HttpServerExchange exchange, Conversation conversation) throws IOException {
        UpdateConversationRequest request = UpdateConversationRequest.from(readJsonBody(exchange));
        Optional<Conversation> updated = store.update(request.applyTo(conversation));
        if (updated.isEmpty()) {
            sendJson(exchange, 404, Map.of("message", "Conversation not found"));
            return;
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("message", "Conversation updated successfully");
        payload.put("data", conversationPayload(updated.get()));
        sendJson(exchange, 200, payload);
    }

    private void listMessages(HttpServerExchange exchange, Conversation conversation) throws IOException {
        List<Map<String, Object>> data = new ArrayList<>();
        for (StoredMessage message : store.messages(conversation.id())) {
            data.add(messagePayload(message));
        }
        sendJson(exchange, 200, Map.of("data", data));
    }

    private void listMessagesByQuery(HttpServerExchange exchange) throws IOException {
        String conversationId = queryParameter(exchange, "conversation_id");
        if (conversationId.isBlank()) {
            throw new RequestValidationException(Map.of("conversation_id", List.of("The conversation ID is required.")));
        }
        if (store.find(conversationId).isEmpty()) {
            throw new RequestValidationException(
                Map.of("conversation_id", List.of("The selected conversation does not exist."))
            );
        }
        int page = parseQueryInt(exchange, "page", 1, 1, Integer.MAX_VALUE);
        List<StoredMessage> messages = store.messages(conversationId);
        int from = Math.min(offset(page, MESSAGES_PER_PAGE), messages.size());
        int to = Math.min(from + MESSAGES_PER_PAGE, messages.size());
        List<Map<String, Object>> data = new ArrayList<>();
        for (StoredMessage message : messages.subList(from, to)) {
            data.add(messagePayload(message));
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("data", data);
        payload.put("meta", pageMeta(page, MESSAGES_PER_PAGE, messages.size()));
        sendJson(exchange, 200, payload);
    }

    private void postMessage(HttpServerExchange exchange, Conversation conversation) throws IOException {
        MessageRequest request = readMessageRequest(exchange);
        String provider = request.modelProvider() == null ? conversation.modelProvider() : request.modelProvider();
        String model = request.modelName() == null ? conversation.modelName() : request.modelName();

        StoredMessage userMessage = store.append(
            conversation.id(),
            MessageRole.USER,
            request.content(),
            null,
            request.images()
        );
        List<Turn> turns = ConversationHistory.toTurns(store.messages(conversation.id()));
        LOG.debug(
            "Message for conversation={} provider={} model={} stream={} images={}",
            conversation.id(),
            provider,
            model,
            request.stream(),
            request.images().size()
        );

        if (request.stream()) {
            streamReply(exchange, conversation, userMessage, provider, model, turns, request);
            return;
        }

        GenerationResult result = gateway.generate(provider, model, turns, request.options());
        StoredMessage assistantMessage = store.append(
            conversation.id(),
            MessageRole.ASSISTANT,
            result.content(),
            result.model(),
            List.of()
        );
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("user_message", messagePayload(userMessage));
        data.put("assistant_message", messagePayload(assistantMessage));
        data.put("usage", result.hasUsage() ? result.usage() : null);
        data.put("model_used", modelUsed(provider, model, result.model()));

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("message", "Message sent successfully");
        payload.put("data", data);
        sendJson(exchange, 200, payload);
    }

    private MessageRequest readMessageRequest(HttpServerExchange exchange) throws IOException {
        String contentType = header(exchange, "Content-Type").toLowerCase(Locale.ROOT);
        if (contentType.startsWith("multipart/form-data")) {
            return readMultipartMessage(exchange);
        }
        return MessageRequest.from(readJsonBody(exchange));
    }

    private MessageRequest readMultipartMessage(HttpServerExchange exchange) throws IOException {
        exchange.startBlocking();
        MultiPartParserDefinition multiPart = new MultiPartParserDefinition();
        multiPart.setTempFileLocation(Paths.get(System.getProperty("java.io.tmpdir")));
        multiPart.setDefaultEncoding(StandardCharsets.UTF_8.name());
        FormDataParser parser = FormParserFactory.builder(false)
            .addParser(multiPart)
            .build()
            .createParser(exchange);
        ObjectNode body = mapper.createObjectNode();
        List<UploadedImage> uploads = new ArrayList<>();
        if (parser == null) {
            return MessageRequest.from(body, uploads);
        }

        FormData form = parser.parseBlocking();
        ObjectNode options = mapper.createObjectNode();
        for (String name : form) {
            for (FormData.FormValue value : form.get(name)) {
                if (value.isFileItem()) {
                    if ("files".equals(name) || "files[]".equals(name)) {
                        uploads.add(toUpload(value));
                    }
                    continue;
                }
                String text = value.getValue();
                if (name.startsWith("options[") && name.endsWith("]")) {
                    putFormNumber(options, name.substring("options[".length(), name.length() - 1), text);
                } else if ("images".equals(name) || "images[]".equals(name)) {
                    ArrayNode images = body.has("images") ? (ArrayNode) body.get("images") : body.putArray("images");
                    images.add(text);
                } else {
                    body.put(name, text);
                }
            }
        }
        if (!options.isEmpty()) {
            body.set("options", options);
        }
        LOG.debug("Multipart message with {} uploaded file(s)", uploads.size());
        return MessageRequest.from(body, uploads);
    }

    private static UploadedImage toUpload(FormData.FormValue value) throws IOException {
        FormData.FileItem item = value.getFileItem();
        byte[] bytes;
        if (item.isInMemory()) {
            try (InputStream in = item.getInputStream()) {
                bytes = in.readAllBytes();
            }
        } else {
            bytes = Files.readAllBytes(item.getFile());
        }
        String fileName = value.getFileName() == null ? "" : value.getFileName();
        String mimeType = value.getHeaders() == null ? null : value.getHeaders().getFirst(Headers.CONTENT_TYPE);
        if (mimeType != null && mimeType.contains(";")) {
            mimeType = mimeType.substring(0, mimeType.indexOf(';'));
        }
        if (mimeType == null || mimeType.isBlank() || "application/octet-stream".equalsIgnoreCase(mimeType.trim())) {
            mimeType = URLConnection.guessContentTypeFromName(fileName);
        }
        return new UploadedImage(fileName, mimeType == null ? null : mimeType.trim(), bytes);
    }

    // Form fields are text; numbers are re-typed so option validation sees them as JSON numbers.
    private static void putFormNumber(ObjectNode target, String key, String raw) {
        String trimmed = raw == null ? "" : raw.trim();
        try {
            if (trimmed.matches("-?\\d+")) {
                target.put(key, new BigInteger(trimmed));
            } else {
                target.put(key, Double.parseDouble(trimmed));
            }
        } catch (NumberFormatException e) {
            target.put(key, trimmed);
        }
    }

    private void streamReply(
        HttpServerExchange exchange,
        Conversation conversation,
        StoredMessage userMessage,
        String provider,
        String model,
        List<Turn> turns,
        MessageRequest request
    ) throws IOException {
        boolean hasImages = turns.stream().anyMatch(Turn::hasImages);
        GenerationStream stream = gateway.generateStreaming(provider, model, turns, request.options());

        exchange.setStatusCode(200);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "text/event-stream; charset=utf-8");
        exchange.getResponseHeaders().put(Headers.CACHE_CONTROL, "no-cache");
        exchange.getResponseHeaders().put(ACCEL_BUFFERING, "no");

        try (stream) {
            OutputStream out = exchange.getOutputStream();
            SseEventWriter writer = new SseEventWriter(out, mapper);
            while (stream.hasNext()) {
                StreamEvent event = stream.next();
                if (event instanceof StreamEvent.Started) {
                    Map<String, Object> start = new LinkedHashMap<>();
                    start.put("status", "generating");
                    start.put("model", model);
                    start.put("provider", provider);
                    start.put("has_images", hasImages);
                    writer.send("start", start);
                } else if (event instanceof StreamEvent.Chunk chunk) {
                    writer.send("chunk", Map.of("content", chunk.text()));
                } else if (event instanceof StreamEvent.Completed completed) {
                    sendCompletion(writer, conversation, userMessage, provider, model, completed);
                } else if (event instanceof StreamEvent.Failed failed) {
                    LOG.warn(
                        "Streaming reply failed conversation={} provider={} model={} kind={}: {}",
                        conversation.id(),
                        provider,
                        model,
                        failed.errorKind(),
                        failed.message()
                    );
                    writer.send("error", Map.of("error", failed.message() == null ? "generation failed" : failed.message()));
                }
            }
            out.close();
        } catch (IOException e) {
            LOG.debug("Client left streaming reply for conversation {}: {}", conversation.id(), e.getMessage());
        }
        exchange.endExchange();
    }

    private void sendCompletion(
        SseEventWriter writer,
        Conversation conversation,
        StoredMessage userMessage,
        String provider,
        String model,
        StreamEvent.Completed completed
    ) throws IOException {
        StoredMessage assistantMessage;
        try {
            assistantMessage = store.append(
                conversation.id(),
                MessageRole.ASSISTANT,
                completed.finalText(),
                completed.model(),
                List.of()
            );
        } catch (IOException e) {
            LOG.warn("Failed to store reply for conversation {}", conversation.id(), e);
            writer.send("error", Map.of("error", "Failed to store assistant message"));
            return;
        }
        Map<String, Object> complete = new LinkedHashMap<>();
        complete.put("message", messagePayload(assistantMessage));
        complete.put("user_message", messagePayload(userMessage));
        complete.put("status", "completed");
        complete.put("model_used", modelUsed(provider, model, completed.model()));
        writer.send("complete", complete);
    }

    private Map<String, Object> modelUsed(String provider, String model, String apiModel) {
        Map<String, Object> modelUsed = new LinkedHashMap<>();
        modelUsed.put("provider", provider);
        modelUsed.put("model", model);
        modelUsed.put("api_model", apiModel);
        return modelUsed;
    }

    private Map<String, Object> conversationPayload(Conversation conversation) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("id", conversation.id());
        payload.put("title", conversation.title());
        payload.put("model_name", conversation.modelName());
        payload.put("model_provider", conversation.modelProvider());
        payload.put("created_at", conversation.createdAt());
        return payload;
    }

    private Map<String, Object> conversationWithMessages(Conversation conversation) throws IOException {
        Map<String, Object> payload = conversationPayload(conversation);
        List<Map<String, Object>> messages = new ArrayList<>();
        for (StoredMessage message : store.messages(conversation.id())) {
            messages.add(messagePayload(message));
        }
        payload.put("messages", messages);
        return payload;
    }

    private Map<String, Object> messagePayload(StoredMessage message) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("id", message.id());
        payload.put("conversation_id", message.conversationId());
        payload.put("content", message.content());
        payload.put("role", message.role().wireValue());
        payload.put("model_name", message.modelName());
        payload.put("has_images", message.hasImages());
        payload.put("image_count", message.images().size());
        payload.put("created_at", message.createdAt());
        return payload;
    }

    private void sendJson(HttpServerExchange exchange, int status, Map<String, ?> payload) throws IOException {
        byte[] body = mapper.writeValueAsBytes(payload);
        exchange.setStatusCode(status);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json; charset=utf-8");
        exchange.getResponseHeaders().put(Headers.CONTENT_LENGTH, String.valueOf(body.length));
        exchange.getResponseSender().send(ByteBuffer.wrap(body));
    }

    private JsonNode readJsonBody(HttpServerExchange exchange) throws IOException {
        exchange.startBlocking();
        byte[] bytes = exchange.getInputStream().readAllBytes();
        if (bytes.length == 0) {
            return mapper.createObjectNode();
        }
        JsonNode node = mapper.readTree(bytes);
        return node == null || !node.isObject() ? mapper.createObjectNode() : node;
    }

    private void sendInternalError(HttpServerExchange exchange, Exception error) {
        LOG.error("Request {} {} failed", exchange.getRequestMethod(), exchange.getRequestPath(), error);
        if (exchange.isResponseStarted()) {
            exchange.endExchange();
            return;
        }
        try {
            sendJson(exchange, 500, Map.of("error", error.getMessage() == null ? "internal_error" : error.getMessage()));
        } catch (IOException e) {
            LOG.debug("Could not report error to client: {}", e.getMessage());
        }
    }

    private static List<String> pathSegments(String relativePath) {
        List<String> segments = new ArrayList<>();
        if (relativePath == null) {
            return segments;
        }
        for (String segment : relativePath.split("/")) {
            if (!segment.isBlank()) {
                segments.add(segment);
            }
        }
        return segments;
    }

    private static boolean isMethod(HttpServerExchange exchange, String method) {
        return method.equalsIgnoreCase(exchange.getRequestMethod().toString());
    }

    private static int offset(int page, int perPage) {
        long offset = (long) (page - 1) * perPage;
        return offset > Integer.MAX_VALUE ? Integer.MAX_VALUE : (int) offset;
    }

    private static Map<String, Object> pageMeta(int page, int perPage, int total) {
        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("current_page", page);
        meta.put("last_page", Math.max(1, (total + perPage - 1) / perPage));
        meta.put("per_page", perPage);
        meta.put("total", total);
        return meta;
    }

    private static String queryParameter(HttpServerExchange exchange, String key) {
        Deque<String> values = exchange.getQueryParameters().get(key);
        if (values == null || values.isEmpty() || values.peekFirst() == null) {
            return "";
        }
        return values.peekFirst().trim();
    }

    private static int parseQueryInt(HttpServerExchange exchange, String key, int fallback, int min, int max) {
        String raw = queryParameter(exchange, key);
        if (raw.isEmpty()) {
            return fallback;
        }
        try {
            int parsed = Integer.parseInt(raw);
            return Math.max(min, Math.min(max, parsed));
        } catch (NumberFormatException e) {
            return fallback;
        }
    }

    private static String header(HttpServerExchange exchange, String name) {
        String value = exchange.getRequestHeaders().getFirst(name);
        return value == null ? "" : value;
    }

    private static int resolveBoundPort(Undertow undertow, int fallbackPort) {
        List<Undertow.ListenerInfo> listeners = undertow.getListenerInfo();
        if (!listeners.isEmpty() && listeners.get(0).getAddress() instanceof InetSocketAddress socketAddress) {
            return socketAddress.getPort();
        }
        return fallbackPort;
    }

    @FunctionalInterface
    private interface ApiHandler {
        void handle(HttpServerExchange exchange, List<String> segments) throws Exception;
    }
}
