package github.sarthakdev143.music_video_studio.service.pipeline;

public record SceneOutcome(
        int sceneNumber,
        long epoch,
        String artifactHandle,
        String errorDetail) {

    public static SceneOutcome succeeded(DispatchTicket ticket, String artifactHandle) {
        return new SceneOutcome(ticket.sceneNumber(), ticket.epoch(), artifactHandle, null);
    }

    public static SceneOutcome failed(DispatchTicket ticket, String errorDetail) {
        return new SceneOutcome(ticket.sceneNumber(), ticket.epoch(), null, errorDetail);
    }

    public boolean isSuccess() {
        return artifactHandle != null;
    }
}
