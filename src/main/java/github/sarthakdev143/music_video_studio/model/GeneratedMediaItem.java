package github.sarthakdev143.music_video_studio.model;

/**
 * Generation state of one storyboard scene.
 *
 * <p>{@code artifactHandle} is present only when {@code status} is {@link SceneStatus#COMPLETE} and
 * {@code errorDetail} only when it is {@link SceneStatus#FAILED}. {@code epoch} increases every time
 * the scene is dispatched or reset, so a generation call can tell whether its result still applies.
 */
public record GeneratedMediaItem(
        int sceneNumber,
        MediaKind mediaKind,
        SceneStatus status,
        String artifactHandle,
        String errorDetail,
        long epoch) {

    public GeneratedMediaItem {
        if (status == null) {
            throw new IllegalArgumentException("status is required.");
        }
        if ((status == SceneStatus.COMPLETE) != (artifactHandle != null)) {
            throw new IllegalArgumentException("artifactHandle must be present iff status is COMPLETE.");
        }
        if ((status == SceneStatus.FAILED) != (errorDetail != null)) {
            throw new IllegalArgumentException("errorDetail must be present iff status is FAILED.");
        }
    }

    public static GeneratedMediaItem pendingFor(StoryboardScene scene) {
        return new GeneratedMediaItem(scene.sceneNumber(), scene.mediaKind(), SceneStatus.PENDING, null, null, 0L);
    }

    public GeneratedMediaItem generating() {
        return new GeneratedMediaItem(sceneNumber, mediaKind, SceneStatus.GENERATING, null, null, epoch + 1);
    }

    public GeneratedMediaItem completed(String handle) {
        return new GeneratedMediaItem(sceneNumber, mediaKind, SceneStatus.COMPLETE, handle, null, epoch);
    }

    public GeneratedMediaItem failed(String detail) {
        return new GeneratedMediaItem(sceneNumber, mediaKind, SceneStatus.FAILED, null, detail, epoch);
    }

    public GeneratedMediaItem resetToPending() {
        return new GeneratedMediaItem(sceneNumber, mediaKind, SceneStatus.PENDING, null, null, epoch + 1);
    }
}
