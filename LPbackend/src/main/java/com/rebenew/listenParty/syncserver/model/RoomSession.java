package com.rebenew.listenParty.syncserver.model;

import com.rebenew.listenParty.protocol.error.RoomException;
import com.rebenew.listenParty.protocol.model.MemberView;
import com.rebenew.listenParty.protocol.model.PlaybackSnapshot;
import org.springframework.web.socket.WebSocketSession;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Estado canónico de una sala: miembros, roles, playlist y último snapshot.
 * Todas las mutaciones pasan por la cola de un solo hilo de la sala, en orden de llegada.
 */
public class RoomSession {
    // IDENTIFICACIÓN
    private final String roomId;
    private final Instant createdAt;
    private volatile String name;
    private volatile String ownerId;
    private volatile String ownerName;
    private volatile RoomStatus status = RoomStatus.ACTIVE;
    private final int maxMembers;

    // MIEMBROS
    private final Map<String, Member> members = new ConcurrentHashMap<>();
    private final AtomicLong joinCounter = new AtomicLong();

    // PLAYLIST Y REPRODUCCIÓN
    private final RoomPlaylist playlist = new RoomPlaylist();
    private volatile PlaybackSnapshot lastSnapshot;

    // CONEXIONES (userId -> sesión WebSocket)
    private final Map<String, WebSocketSession> connections = new ConcurrentHashMap<>();

    // COLA DE MUTACIONES
    private final ExecutorService queue;

    public RoomSession(String roomId, String name, String ownerId, String ownerName, int maxMembers, Instant createdAt) {
        this.roomId = roomId;
        this.name = name;
        this.ownerId = ownerId;
        this.ownerName = ownerName;
        this.maxMembers = maxMembers;
        this.createdAt = createdAt;
        this.queue = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r);
            t.setDaemon(true);
            t.setName("room-" + roomId + "-queue");
            return t;
        });
    }

    // ========== COLA ==========

    /**
     * Encola una operación sobre la sala. El futuro falla con ROOM_NOT_FOUND
     * si la cola ya fue cerrada por una disolución.
     */
    public <T> CompletableFuture<T> submit(Supplier<T> operation) {
        CompletableFuture<T> future = new CompletableFuture<>();
        try {
            queue.execute(() -> {
                try {
                    future.complete(operation.get());
                } catch (Throwable t) {
                    future.completeExceptionally(t);
                }
            });
        } catch (RejectedExecutionException e) {
            future.completeExceptionally(RoomException.roomNotFound(roomId));
        }
        return future;
    }

    // Las tareas ya encoladas se ejecutan y fallan al ver la sala disuelta
    public void shutdownQueue() {
        queue.shutdown();
    }

    // ========== MIEMBROS ==========

    public Member addMember(Member member) {
        members.put(member.getUserId(), member);
        return member;
    }

    public Member removeMember(String userId) {
        return members.remove(userId);
    }

    public Member getMember(String userId) {
        return userId != null ? members.get(userId) : null;
    }

    public Member requireMember(String userId) {
        Member member = getMember(userId);
        if (member == null) {
            throw RoomException.permissionDenied("el usuario " + userId + " no es miembro de la sala " + roomId);
        }
        return member;
    }

    public boolean isMember(String userId) {
        return getMember(userId) != null;
    }

    public boolean isFull() {
        return members.size() >= maxMembers;
    }

    public long nextJoinOrder() {
        return joinCounter.incrementAndGet();
    }

    // Miembros en orden de entrada
    public List<Member> getMembers() {
        List<Member> list = new ArrayList<>(members.values());
        list.sort(Comparator.comparingLong(Member::getJoinOrder));
        return list;
    }

    public List<MemberView> getMemberViews() {
        return getMembers().stream().map(Member::toView).collect(Collectors.toList());
    }

    public Member getOwner() {
        return getMember(ownerId);
    }

    /**
     * El master es derivado: el owner mientras está en modo listen.
     */
    public Member getMaster() {
        Member owner = getOwner();
        return owner != null && owner.isOwner() && owner.isListening() ? owner : null;
    }

    // Master con conexión abierta, capaz de responder a un master_request
    public Member getActiveMaster() {
        Member master = getMaster();
        return master != null && master.isOnline() && isConnected(master.getUserId()) ? master : null;
    }

    public List<Member> getFollowers() {
        Member master = getMaster();
        return getMembers().stream()
                .filter(Member::isListening)
                .filter(m -> master == null || !m.getUserId().equals(master.getUserId()))
                .collect(Collectors.toList());
    }

    // ========== CONEXIONES ==========

    /**
     * Asocia la sesión WebSocket del usuario y devuelve la anterior, si la había.
     */
    public WebSocketSession attachConnection(String userId, WebSocketSession session) {
        return connections.put(userId, session);
    }

    // Solo desvincula si la sesión sigue siendo la actual (evita carreras con reconexiones)
    public boolean detachConnection(String userId, WebSocketSession session) {
        return connections.remove(userId, session);
    }

    public WebSocketSession removeConnection(String userId) {
        return connections.remove(userId);
    }

    public WebSocketSession getConnection(String userId) {
        return connections.get(userId);
    }

    public boolean isConnected(String userId) {
        WebSocketSession s = connections.get(userId);
        return s != null && s.isOpen();
    }

    public Map<String, WebSocketSession> getConnections() {
        return connections;
    }

    // ========== DTO ==========

    public RoomResponse toRoomResponse() {
        return new RoomResponse(roomId, name, ownerId, ownerName, status, createdAt.toEpochMilli(),
                members.size(), maxMembers);
    }

    public RoomStateResponse toStateResponse(String viewerId) {
        Member viewer = getMember(viewerId);
        Member master = getMaster();
        return RoomStateResponse.builder()
                .room(toRoomResponse())
                .members(getMemberViews())
                .playlist(playlist.getItems())
                .playback(lastSnapshot)
                .masterId(master != null ? master.getUserId() : null)
                .you(viewer != null ? viewer.toView() : null)
                .build();
    }

    public UserRoomInfo toUserRoomInfo(String userId) {
        Member member = getMember(userId);
        return new UserRoomInfo(roomId, name, ownerId, ownerName, members.size(), ownerId.equals(userId),
                member != null ? member.getJoinedAt() : 0L, status);
    }

    // ========== GETTERS / SETTERS ==========

    public String getRoomId() {
        return roomId;
    }

    public String getName() {
        return name;
    }

    public String getOwnerId() {
        return ownerId;
    }

    public String getOwnerName() {
        return ownerName;
    }

    public void setOwner(String ownerId, String ownerName) {
        this.ownerId = ownerId;
        this.ownerName = ownerName;
    }

    public boolean isOwner(String userId) {
        return ownerId != null && ownerId.equals(userId);
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public RoomStatus getStatus() {
        return status;
    }

    public boolean isActive() {
        return status == RoomStatus.ACTIVE;
    }

    public void markDisbanded() {
        this.status = RoomStatus.DISBANDED;
    }

    public int getMaxMembers() {
        return maxMembers;
    }

    public int getMemberCount() {
        return members.size();
    }

    public RoomPlaylist getPlaylist() {
        return playlist;
    }

    public PlaybackSnapshot getLastSnapshot() {
        return lastSnapshot;
    }

    public void setLastSnapshot(PlaybackSnapshot lastSnapshot) {
        this.lastSnapshot = lastSnapshot;
    }

    @Override
    public String toString() {
        return "RoomSession{" +
                "roomId='" + roomId + '\'' +
                ", ownerId='" + ownerId + '\'' +
                ", status=" + status +
                ", members=" + members.size() +
                ", playlistSize=" + playlist.size() +
                ", connections=" + connections.size() +
                '}';
    }
}
