package com.rebenew.listenParty.syncclient;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rebenew.listenParty.protocol.MessageTypes;
import com.rebenew.listenParty.protocol.SyncMsg;
import com.rebenew.listenParty.protocol.model.ChatMessageView;
import com.rebenew.listenParty.protocol.model.MemberMode;
import com.rebenew.listenParty.protocol.model.MemberView;
import com.rebenew.listenParty.protocol.model.PlaybackSnapshot;
import com.rebenew.listenParty.protocol.model.PlaylistItem;
import com.rebenew.listenParty.syncclient.chat.ChatHistorySource;
import com.rebenew.listenParty.syncclient.chat.RoomChatFeed;
import com.rebenew.listenParty.syncclient.player.LocalPlayer;
import com.rebenew.listenParty.syncclient.sync.FollowerSynchronizer;
import com.rebenew.listenParty.syncclient.sync.PlaybackReporter;
import com.rebenew.listenParty.syncclient.transport.RoomTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Cliente de una sala de escucha.
 * <p>
 * Mantiene la proyección local (miembros, playlist, master, último snapshot), decide si este
 * cliente reporta (master) o se reconcilia (seguidor) y se reconecta con backoff exponencial,
 * resincronizando explícitamente al volver. Mensajes entrantes y temporizadores se procesan en
 * un único hilo; las peticiones HTTP (historial) van a un ejecutor aparte y su resultado vuelve
 * a ese hilo.
 */
public class RoomSyncClient implements RoomTransport.Listener {
    private static final Logger logger = LoggerFactory.getLogger(RoomSyncClient.class);

    private static final TypeReference<List<MemberView>> MEMBER_LIST = new TypeReference<>() {
    };
    private static final TypeReference<List<PlaylistItem>> PLAYLIST = new TypeReference<>() {
    };

    public enum ConnectionState {
        DISCONNECTED, CONNECTING, CONNECTED, RECONNECTING, CLOSED
    }

    private final String roomId;
    private final String userId;
    private final String username;
    private final String avatar;

    private final RoomTransport transport;
    private final LocalPlayer player;
    private final SyncOptions options;
    private final ObjectMapper objectMapper;
    private final ScheduledExecutorService loop;
    private final Executor ioExecutor;

    private final PlaybackReporter reporter;
    private final FollowerSynchronizer synchronizer;
    private final RoomChatFeed chatFeed;

    private volatile RoomEventListener listener = new RoomEventListener() {
    };

    // Proyección local del estado de la sala
    private volatile List<MemberView> members = Collections.emptyList();
    private volatile List<PlaylistItem> playlist = Collections.emptyList();
    private volatile String masterId;
    private volatile PlaybackSnapshot lastSnapshot;
    private volatile MemberView self;
    // último modo pedido por este cliente; un cambio distinto lo impuso el servidor
    private volatile MemberMode requestedMode;

    private volatile ConnectionState connectionState = ConnectionState.DISCONNECTED;
    private int reconnectAttempts;
    private volatile ScheduledFuture<?> keepAlive;

    public RoomSyncClient(String roomId, String userId, String username, String avatar, RoomTransport transport,
            LocalPlayer player, ChatHistorySource historySource, ObjectMapper objectMapper, SyncOptions options) {
        this(roomId, userId, username, avatar, transport, player, historySource, objectMapper, options,
                Clock.systemUTC(), Executors.newSingleThreadScheduledExecutor(r -> {
                    Thread t = new Thread(r, "room-client-" + roomId);
                    t.setDaemon(true);
                    return t;
                }), Executors.newSingleThreadExecutor(r -> {
                    Thread t = new Thread(r, "room-client-io-" + roomId);
                    t.setDaemon(true);
                    return t;
                }));
    }

    public RoomSyncClient(String roomId, String userId, String username, String avatar, RoomTransport transport,
            LocalPlayer player, ChatHistorySource historySource, ObjectMapper objectMapper, SyncOptions options,
            Clock clock, ScheduledExecutorService loop, Executor ioExecutor) {
        this.roomId = roomId;
        this.userId = userId;
        this.username = username;
        this.avatar = avatar;
        this.transport = transport;
        this.player = player;
        this.options = options;
        this.objectMapper = objectMapper;
        this.loop = loop;
        this.ioExecutor = ioExecutor;
        this.reporter = new PlaybackReporter(player, this::sendReport, options, loop);
        this.synchronizer = new FollowerSynchronizer(player, options, clock, this::runOnLoop);
        this.chatFeed = new RoomChatFeed(roomId, userId, username, transport, historySource, clock);
        player.addListener(reporter);
    }

    public void setListener(RoomEventListener listener) {
        this.listener = listener != null ? listener : new RoomEventListener() {
        };
    }

    // ==================== CONEXIÓN ====================

    public void start() {
        if (connectionState == ConnectionState.CLOSED) {
            throw new IllegalStateException("cliente cerrado");
        }
        updateConnectionState(ConnectionState.CONNECTING);
        transport.connect(this);
    }

    public void close() {
        updateConnectionState(ConnectionState.CLOSED);
        reporter.setActive(false);
        stopKeepAlive();
        synchronizer.stop();
        player.removeListener(reporter);
        transport.close();
        loop.shutdownNow();
        if (ioExecutor instanceof ExecutorService) {
            ((ExecutorService) ioExecutor).shutdownNow();
        }
    }

    @Override
    public void onOpen() {
        runOnLoop(this::resync);
    }

    @Override
    public void onMessage(SyncMsg message) {
        runOnLoop(() -> handleMessage(message));
    }

    @Override
    public void onClose(String reason) {
        runOnLoop(() -> handleClose(reason));
    }

    /**
     * Tras (re)conectar: auth → estado completo, historial de chat de nuevo.
     * La petición de snapshot sale al recibir el estado completo; el historial se pide fuera
     * del hilo del cliente y se fusiona al volver.
     */
    void resync() {
        reconnectAttempts = 0;
        updateConnectionState(ConnectionState.CONNECTED);

        SyncMsg auth = SyncMsg.auth(roomId, userId, username).withCorrelationId(newCorrelationId());
        if (avatar != null) {
            auth.getDataAsMap().put("avatar", avatar);
        }
        transport.send(auth);
        startKeepAlive();

        loadHistoryAsync(options.getHistoryLimit());
        listener.onRoomStateChanged(this);
    }

    private void loadHistoryAsync(int limit) {
        try {
            CompletableFuture.supplyAsync(() -> chatFeed.fetchHistory(limit), ioExecutor)
                    .whenComplete((history, ex) -> runOnLoop(() -> {
                        if (ex != null) {
                            Throwable cause = ex.getCause() != null ? ex.getCause() : ex;
                            logger.warn("⚠️ No se pudo cargar el historial de chat de la sala {}: {}", roomId,
                                    cause.getMessage());
                            return;
                        }
                        if (connectionState == ConnectionState.CLOSED) {
                            return;
                        }
                        chatFeed.mergeHistory(history);
                        listener.onRoomStateChanged(this);
                    }));
        } catch (RejectedExecutionException e) {
            logger.debug("History load for room {} skipped: client closed", roomId);
        }
    }

    // El servidor cierra las sesiones sin actividad; un cliente que solo escucha no envía nada más.
    private void startKeepAlive() {
        if (keepAlive != null) {
            return;
        }
        keepAlive = loop.scheduleAtFixedRate(this::sendKeepAlive, options.getKeepAliveIntervalMs(),
                options.getKeepAliveIntervalMs(), TimeUnit.MILLISECONDS);
    }

    private void stopKeepAlive() {
        if (keepAlive != null) {
            keepAlive.cancel(false);
            keepAlive = null;
        }
    }

    void sendKeepAlive() {
        if (connectionState != ConnectionState.CONNECTED || !transport.isConnected()) {
            return;
        }
        transport.send(SyncMsg.heartbeat(roomId, userId));
    }

    void handleClose(String reason) {
        if (connectionState == ConnectionState.CLOSED) {
            return;
        }
        // sin canal no hay reportes; los seguidores se quedan en el último snapshot
        reporter.setActive(false);
        stopKeepAlive();

        if (reconnectAttempts >= options.getReconnectMaxAttempts()) {
            logger.error("❌ Sala {}: reconexión abandonada tras {} intentos ({})", roomId, reconnectAttempts,
                    reason);
            updateConnectionState(ConnectionState.DISCONNECTED);
            return;
        }
        long delay = reconnectDelayMs(reconnectAttempts, options);
        reconnectAttempts++;
        updateConnectionState(ConnectionState.RECONNECTING);
        logger.warn("🔁 Sala {}: conexión perdida ({}), reintento {} en {}ms", roomId, reason, reconnectAttempts,
                delay);
        loop.schedule(() -> transport.connect(this), delay, TimeUnit.MILLISECONDS);
    }

    static long reconnectDelayMs(int attempt, SyncOptions options) {
        long delay = options.getReconnectBaseDelayMs();
        for (int i = 0; i < attempt && delay < options.getReconnectMaxDelayMs(); i++) {
            delay *= 2;
        }
        return Math.min(delay, options.getReconnectMaxDelayMs());
    }

    // ==================== MENSAJES ENTRANTES ====================

    void handleMessage(SyncMsg msg) {
        if (msg == null || msg.getType() == null) {
            return;
        }
        switch (msg.getType()) {
            case MessageTypes.FULL_STATE:
                applyFullState(msg.getDataAsMap());
                break;
            case MessageTypes.MEMBER_LIST:
                applyMemberList(msg.getDataAsMap());
                break;
            case MessageTypes.PLAYLIST:
                Map<String, Object> playlistData = msg.getDataAsMap();
                if (playlistData != null) {
                    playlist = convertList(playlistData.get("items"), PLAYLIST);
                    listener.onRoomStateChanged(this);
                }
                break;
            case MessageTypes.MODE:
                handleMode(msg);
                break;
            case MessageTypes.PLAYBACK:
                handlePlayback(msg);
                break;
            case MessageTypes.CHAT:
                ChatMessageView message = objectMapper.convertValue(msg.getData(), ChatMessageView.class);
                if (chatFeed.onLive(message)) {
                    listener.onChatMessage(message);
                }
                break;
            case MessageTypes.MEMBER:
                // member_list llega justo después; aquí solo interesan los cambios propios
                if (MessageTypes.MEMBER_ROLE_UPDATE.equals(msg.getSubType())
                        && userId.equals(msg.getStringData("userId"))) {
                    logger.info("👑 Nuevo rol en sala {}: {}", roomId, msg.getStringData("role"));
                }
                break;
            case MessageTypes.ROOM:
                if (MessageTypes.ROOM_DISBAND.equals(msg.getSubType())) {
                    handleDisband();
                }
                break;
            case MessageTypes.ERROR:
                String code = msg.getStringData("code");
                if (chatFeed.onSendFailed(msg.getCorrelationId())) {
                    listener.onRoomStateChanged(this);
                }
                logger.warn("⚠️ Error del servidor [{}]: {}", code, msg.getStringData("message"));
                listener.onError(code, msg.getStringData("message"), msg.getCorrelationId());
                break;
            case MessageTypes.ACK:
                logger.debug("ACK {} ({})", msg.getCorrelationId(), msg.getStringData("reason"));
                break;
            default:
                logger.debug("Unhandled message type {}", msg.getType());
        }
    }

    private void applyFullState(Map<String, Object> data) {
        if (data == null) {
            return;
        }
        members = convertList(data.get("members"), MEMBER_LIST);
        playlist = convertList(data.get("playlist"), PLAYLIST);
        masterId = data.get("masterId") != null ? data.get("masterId").toString() : null;
        if (data.get("playback") != null) {
            lastSnapshot = objectMapper.convertValue(data.get("playback"), PlaybackSnapshot.class);
        }
        if (data.get("you") != null) {
            self = objectMapper.convertValue(data.get("you"), MemberView.class);
        } else {
            self = findSelf(members);
        }
        updateRoles();

        if (isFollower()) {
            requestPlayback();
        }
        listener.onRoomStateChanged(this);
    }

    private void applyMemberList(Map<String, Object> data) {
        if (data == null) {
            return;
        }
        members = convertList(data.get("members"), MEMBER_LIST);
        masterId = data.get("masterId") != null ? data.get("masterId").toString() : null;
        MemberView updated = findSelf(members);
        if (updated != null) {
            self = updated;
        }
        updateRoles();
        listener.onRoomStateChanged(this);
    }

    private void handleMode(SyncMsg msg) {
        if (MessageTypes.MODE_MASTER_MODE.equals(msg.getSubType())) {
            // solo informativo: si este cliente debe dejar listen, el servidor envía su mode_set
            boolean active = msg.getBoolData("active", false);
            masterId = active ? msg.getStringData("masterId") : null;
            listener.onRoomStateChanged(this);
        } else if (MessageTypes.MODE_SET.equals(msg.getSubType()) && userId.equals(msg.getStringData("userId"))) {
            MemberView me = self;
            if (me == null) {
                return;
            }
            MemberMode previous = me.getMode();
            MemberMode mode = MemberMode.fromValue(msg.getStringData("mode"));
            me.setMode(mode);
            boolean forced = previous == MemberMode.LISTEN && mode == MemberMode.CHAT
                    && requestedMode != MemberMode.CHAT;
            requestedMode = null;
            updateRoles();
            if (forced) {
                logger.info("💬 Sala {}: el master dejó de reproducir, modo chat forzado", roomId);
                listener.onModeForced();
            }
            listener.onRoomStateChanged(this);
        }
    }

    private void handlePlayback(SyncMsg msg) {
        String subType = msg.getSubType();
        if (MessageTypes.PLAYBACK_MASTER_SYNC.equals(subType)) {
            PlaybackSnapshot snapshot = objectMapper.convertValue(msg.getData(), PlaybackSnapshot.class);
            lastSnapshot = snapshot;
            MemberView me = self;
            synchronizer.onSnapshot(snapshot, me != null && me.isOwner());
            listener.onRoomStateChanged(this);
        } else if (MessageTypes.PLAYBACK_MASTER_REQUEST.equals(subType)) {
            logger.debug("📡 master_request from {}", msg.getStringData("requesterId"));
            reporter.onMasterRequest();
        } else if (MessageTypes.PLAYBACK_CONTROL.equals(subType)) {
            applyControl(msg);
        }
    }

    /**
     * Comando reenviado por el servidor: el master lo aplica a su propio reproductor y
     * el reporter emite el nuevo estado.
     */
    void applyControl(SyncMsg msg) {
        if (!reporter.isActive()) {
            logger.warn("Control ignorado: este cliente no es el master");
            return;
        }
        String command = msg.getStringData("command");
        if (command == null) {
            return;
        }
        logger.info("🎛️ Aplicando '{}' pedido por {}", command, msg.getStringData("requestedBy"));
        switch (command) {
            case MessageTypes.COMMAND_PLAY:
                player.play();
                break;
            case MessageTypes.COMMAND_PAUSE:
                player.pause();
                break;
            case MessageTypes.COMMAND_SEEK:
                Double position = msg.getDoubleData("positionSeconds");
                if (position != null) {
                    player.seek(position);
                }
                break;
            case MessageTypes.COMMAND_NEXT:
                playRelative(1);
                break;
            case MessageTypes.COMMAND_PREV:
                playRelative(-1);
                break;
            case MessageTypes.COMMAND_PLAY_SONG:
                Map<String, Object> data = msg.getDataAsMap();
                if (data != null && data.get("song") != null) {
                    playItem(objectMapper.convertValue(data.get("song"), PlaylistItem.class));
                }
                break;
            default:
                logger.warn("Comando desconocido: {}", command);
        }
    }

    private void playRelative(int offset) {
        List<PlaylistItem> items = playlist;
        String current = player.currentSongId();
        int index = -1;
        for (PlaylistItem item : items) {
            if (item.songId().equals(current)) {
                index = item.position();
                break;
            }
        }
        int target = index + offset;
        if (index < 0 || target < 0 || target >= items.size()) {
            logger.debug("No {} song from position {}", offset > 0 ? "next" : "previous", index);
            return;
        }
        playItem(items.get(target));
    }

    private void playItem(PlaylistItem item) {
        player.load(item).whenComplete((ignored, ex) -> {
            if (ex != null) {
                logger.warn("⚠️ No se pudo cargar {}: {}", item.songId(), ex.getMessage());
            } else {
                player.play();
            }
        });
    }

    private void handleDisband() {
        logger.info("💥 Sala {} disuelta", roomId);
        updateConnectionState(ConnectionState.CLOSED);
        reporter.setActive(false);
        stopKeepAlive();
        synchronizer.stop();
        transport.close();
        listener.onDisbanded();
    }

    // ==================== ROLES ====================

    /**
     * Master = owner en listen; seguidor = no owner en listen.
     */
    private void updateRoles() {
        reporter.setActive(isMaster() && transport.isConnected());
        if (isFollower()) {
            if (!synchronizer.isEnabled()) {
                synchronizer.start();
            }
        } else if (synchronizer.isEnabled()) {
            synchronizer.stop();
        }
    }

    public boolean isMaster() {
        MemberView me = self;
        return me != null && me.isOwner() && me.getMode() == MemberMode.LISTEN;
    }

    public boolean isFollower() {
        MemberView me = self;
        return me != null && !me.isOwner() && me.getMode() == MemberMode.LISTEN;
    }

    // ==================== OPERACIONES SALIENTES ====================

    public String setMode(MemberMode mode) {
        requestedMode = mode;
        return request(MessageTypes.MODE, MessageTypes.MODE_SET, Map.of("mode", mode.getValue()));
    }

    public String requestPlayback() {
        return request(MessageTypes.PLAYBACK, MessageTypes.PLAYBACK_REQUEST, null);
    }

    public String addSong(PlaylistItem song) {
        Map<String, Object> data = new HashMap<>();
        data.put("songId", song.songId());
        data.put("name", song.name());
        data.put("artist", song.artist());
        data.put("cover", song.cover());
        data.put("duration", song.duration());
        data.put("source", song.source().getValue());
        return request(MessageTypes.PLAYLIST, MessageTypes.PLAYLIST_ADD, data);
    }

    public String removeSong(int position) {
        return request(MessageTypes.PLAYLIST, MessageTypes.PLAYLIST_REMOVE, Map.of("position", position));
    }

    public String reorderSong(int from, int to) {
        return request(MessageTypes.PLAYLIST, MessageTypes.PLAYLIST_REORDER, Map.of("from", from, "to", to));
    }

    /**
     * play, pause, next, prev; seek y play_song usan sus variantes.
     */
    public String control(String command) {
        return request(MessageTypes.PLAYBACK, MessageTypes.PLAYBACK_CONTROL, Map.of("command", command));
    }

    public String seek(double positionSeconds) {
        return request(MessageTypes.PLAYBACK, MessageTypes.PLAYBACK_CONTROL,
                Map.of("command", MessageTypes.COMMAND_SEEK, "positionSeconds", positionSeconds));
    }

    public String playSong(int songPosition) {
        return request(MessageTypes.PLAYBACK, MessageTypes.PLAYBACK_CONTROL,
                Map.of("command", MessageTypes.COMMAND_PLAY_SONG, "songPosition", songPosition));
    }

    public String grantControl(String targetUserId, boolean canControl) {
        return request(MessageTypes.MEMBER, MessageTypes.MEMBER_GRANT_CONTROL,
                Map.of("userId", targetUserId, "canControl", canControl));
    }

    public String transferOwner(String targetUserId) {
        return request(MessageTypes.MEMBER, MessageTypes.MEMBER_TRANSFER_OWNER, Map.of("userId", targetUserId));
    }

    public ChatMessageView sendChat(String content) {
        ChatMessageView provisional = chatFeed.send(content);
        listener.onRoomStateChanged(this);
        return provisional;
    }

    public String leave() {
        String correlationId = request(MessageTypes.ROOM, MessageTypes.ROOM_LEAVE, null);
        close();
        return correlationId;
    }

    public String disband() {
        return request(MessageTypes.ROOM, MessageTypes.ROOM_DISBAND, null);
    }

    private void sendReport(PlaybackSnapshot snapshot) {
        request(MessageTypes.PLAYBACK, MessageTypes.PLAYBACK_REPORT, snapshot);
    }

    private String request(String type, String subType, Object data) {
        String correlationId = newCorrelationId();
        SyncMsg msg = SyncMsg.request(type, subType, roomId, userId, data).withCorrelationId(correlationId);
        if (!transport.send(msg)) {
            logger.debug("Message {}/{} not sent: transport down", type, subType);
            return null;
        }
        return correlationId;
    }

    // ==================== UTILIDADES ====================

    private void runOnLoop(Runnable task) {
        try {
            loop.execute(() -> {
                try {
                    task.run();
                } catch (RuntimeException e) {
                    logger.error("❌ Error procesando evento de la sala {}: {}", roomId, e.getMessage(), e);
                }
            });
        } catch (RejectedExecutionException e) {
            logger.debug("Event for room {} dropped: client closed", roomId);
        }
    }

    private void updateConnectionState(ConnectionState state) {
        if (connectionState != state) {
            connectionState = state;
            listener.onConnectionStateChanged(state);
        }
    }

    private MemberView findSelf(List<MemberView> list) {
        for (MemberView member : list) {
            if (Objects.equals(userId, member.getUserId())) {
                return member;
            }
        }
        return null;
    }

    private <T> List<T> convertList(Object raw, TypeReference<List<T>> type) {
        if (raw == null) {
            return Collections.emptyList();
        }
        return Collections.unmodifiableList(new ArrayList<>(objectMapper.convertValue(raw, type)));
    }

    private static String newCorrelationId() {
        return UUID.randomUUID().toString();
    }

    // ==================== PROYECCIÓN ====================

    public String getRoomId() {
        return roomId;
    }

    public String getUserId() {
        return userId;
    }

    public List<MemberView> getMembers() {
        return members;
    }

    public List<PlaylistItem> getPlaylist() {
        return playlist;
    }

    public String getMasterId() {
        return masterId;
    }

    public PlaybackSnapshot getLastSnapshot() {
        return lastSnapshot;
    }

    public MemberView getSelf() {
        return self;
    }

    public ConnectionState getConnectionState() {
        return connectionState;
    }

    public List<ChatMessageView> getChatMessages() {
        return chatFeed.getMessages();
    }

    public FollowerSynchronizer.State getFollowerState() {
        return synchronizer.getState();
    }

    PlaybackReporter getReporter() {
        return reporter;
    }
}
