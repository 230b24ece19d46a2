package com.rebenew.listenParty.syncserver.model;

import com.rebenew.listenParty.protocol.error.RoomException;
import com.rebenew.listenParty.protocol.model.PlaylistItem;

import java.util.ArrayList;
import java.util.List;

/**
 * Playlist ordenada de una sala.
 * Invariante: las posiciones son exactamente 0..size-1 tras cada operación.
 * Cada mutación publica una lista nueva, así los lectores fuera de la cola
 * nunca ven una numeración a medias.
 */
public class RoomPlaylist {

    private volatile List<PlaylistItem> items = List.of();

    public synchronized PlaylistItem add(PlaylistItem item, String addedBy, long addedAt) {
        if (indexOf(item.songId()) >= 0) {
            throw RoomException.validation("la canción ya está en la playlist: " + item.songId());
        }
        List<PlaylistItem> next = new ArrayList<>(items);
        PlaylistItem placed = item.withAddedBy(addedBy, addedAt).withPosition(next.size());
        next.add(placed);
        items = List.copyOf(next);
        return placed;
    }

    public synchronized PlaylistItem remove(int position) {
        checkIndex(position);
        List<PlaylistItem> next = new ArrayList<>(items);
        PlaylistItem removed = next.remove(position);
        renumber(next, position);
        items = List.copyOf(next);
        return removed;
    }

    // Movimiento de un solo elemento: quitar y volver a insertar
    public synchronized PlaylistItem reorder(int from, int to) {
        checkIndex(from);
        checkIndex(to);
        List<PlaylistItem> next = new ArrayList<>(items);
        PlaylistItem moved = next.remove(from);
        next.add(to, moved);
        renumber(next, Math.min(from, to));
        items = List.copyOf(next);
        return next.get(to);
    }

    public List<PlaylistItem> getItems() {
        return items;
    }

    public PlaylistItem get(int position) {
        List<PlaylistItem> current = items;
        if (position < 0 || position >= current.size()) {
            throw RoomException.outOfRange(position, current.size());
        }
        return current.get(position);
    }

    public int indexOf(String songId) {
        List<PlaylistItem> current = items;
        for (int i = 0; i < current.size(); i++) {
            if (current.get(i).songId().equals(songId)) {
                return i;
            }
        }
        return -1;
    }

    public int size() {
        return items.size();
    }

    private void checkIndex(int position) {
        if (position < 0 || position >= items.size()) {
            throw RoomException.outOfRange(position, items.size());
        }
    }

    private static void renumber(List<PlaylistItem> list, int from) {
        for (int i = from; i < list.size(); i++) {
            list.set(i, list.get(i).withPosition(i));
        }
    }
}
