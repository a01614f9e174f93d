package github.sarthakdev143.music_video_studio.service.pipeline;

import github.sarthakdev143.music_video_studio.model.GeneratedMediaItem;
import github.sarthakdev143.music_video_studio.model.MediaKind;
import github.sarthakdev143.music_video_studio.model.SceneStatus;
import github.sarthakdev143.music_video_studio.model.StoryboardScene;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * One generation slot per storyboard scene. Slots are created with the table and never added or
 * removed; only their state changes, and every change happens under the table's monitor.
 */
public class SceneTable {

    private final Map<Integer, StoryboardScene> scenes = new LinkedHashMap<>();
    private final Map<Integer, GeneratedMediaItem> items = new LinkedHashMap<>();

    public SceneTable(List<StoryboardScene> storyboard) {
        for (StoryboardScene scene : storyboard) {
            if (scenes.putIfAbsent(scene.sceneNumber(), scene) != null) {
                throw new IllegalArgumentException("Duplicate scene number " + scene.sceneNumber() + ".");
            }
            items.put(scene.sceneNumber(), GeneratedMediaItem.pendingFor(scene));
        }
    }

    public synchronized List<StoryboardScene> pending(MediaKind kind, int limit) {
        List<StoryboardScene> pending = new ArrayList<>();
        for (GeneratedMediaItem item : items.values()) {
            if (pending.size() >= limit) {
                break;
            }
            if (item.mediaKind() == kind && item.status() == SceneStatus.PENDING) {
                pending.add(scenes.get(item.sceneNumber()));
            }
        }
        return pending;
    }

    public synchronized boolean hasPending() {
        return items.values().stream().anyMatch(item -> item.status() == SceneStatus.PENDING);
    }

    public synchronized boolean hasPending(MediaKind kind) {
        return items.values()
                .stream()
                .anyMatch(item -> item.mediaKind() == kind && item.status() == SceneStatus.PENDING);
    }

    public synchronized boolean hasUnsettled() {
        return items.values().stream().anyMatch(item -> !item.status().isTerminal());
    }

    public synchronized boolean allComplete() {
        return items.values().stream().allMatch(item -> item.status() == SceneStatus.COMPLETE);
    }

    public synchronized long count(SceneStatus status) {
        return items.values().stream().filter(item -> item.status() == status).count();
    }

    /**
     * Moves every scene of the batch to GENERATING in one step and hands out the epochs their
     * results must carry back.
     */
    public synchronized List<DispatchTicket> markGenerating(List<StoryboardScene> batch) {
        for (StoryboardScene scene : batch) {
            GeneratedMediaItem current = requireItem(scene.sceneNumber());
            if (current.status() != SceneStatus.PENDING) {
                throw new IllegalStateException(
                        "Scene " + scene.sceneNumber() + " is " + current.status() + ", expected PENDING.");
            }
        }

        List<DispatchTicket> tickets = new ArrayList<>(batch.size());
        for (StoryboardScene scene : batch) {
            GeneratedMediaItem generating = items.get(scene.sceneNumber()).generating();
            items.put(scene.sceneNumber(), generating);
            tickets.add(new DispatchTicket(scenes.get(scene.sceneNumber()), generating.epoch()));
        }
        return tickets;
    }

    /**
     * Writes back a whole batch at once. Outcomes whose epoch no longer matches the scene, because
     * the scene was reset while its call was running, are returned as discarded.
     */
    public synchronized MergeResult merge(List<SceneOutcome> outcomes) {
        int completed = 0;
        int failed = 0;
        List<SceneOutcome> discarded = new ArrayList<>();

        for (SceneOutcome outcome : outcomes) {
            GeneratedMediaItem current = requireItem(outcome.sceneNumber());
            if (current.status() != SceneStatus.GENERATING || current.epoch() != outcome.epoch()) {
                discarded.add(outcome);
                continue;
            }
            if (outcome.isSuccess()) {
                items.put(outcome.sceneNumber(), current.completed(outcome.artifactHandle()));
                completed++;
            } else {
                items.put(outcome.sceneNumber(), current.failed(outcome.errorDetail()));
                failed++;
            }
        }
        return new MergeResult(completed, failed, discarded);
    }

    public synchronized int markFailed(List<DispatchTicket> tickets, String errorDetail) {
        int failed = 0;
        for (DispatchTicket ticket : tickets) {
            GeneratedMediaItem current = requireItem(ticket.sceneNumber());
            if (current.status() == SceneStatus.GENERATING && current.epoch() == ticket.epoch()) {
                items.put(ticket.sceneNumber(), current.failed(errorDetail));
                failed++;
            }
        }
        return failed;
    }

    /**
     * Returns a terminal scene to PENDING and gives back the state it had before.
     */
    public synchronized GeneratedMediaItem reset(int sceneNumber) {
        GeneratedMediaItem current = requireItem(sceneNumber);
        if (!current.status().isTerminal()) {
            throw new IllegalStateException(
                    "Scene " + sceneNumber + " is " + current.status() + " and cannot be regenerated yet.");
        }
        items.put(sceneNumber, current.resetToPending());
        return current;
    }

    public synchronized Optional<GeneratedMediaItem> find(int sceneNumber) {
        return Optional.ofNullable(items.get(sceneNumber));
    }

    public synchronized List<GeneratedMediaItem> snapshot() {
        return List.copyOf(items.values());
    }

    public Set<Integer> sceneNumbers() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(scenes.keySet()));
    }

    public List<StoryboardScene> storyboard() {
        return List.copyOf(scenes.values());
    }

    private GeneratedMediaItem requireItem(int sceneNumber) {
        GeneratedMediaItem item = items.get(sceneNumber);
        if (item == null) {
            throw new IllegalArgumentException("Scene " + sceneNumber + " does not exist.");
        }
        return item;
    }
}
