package github.sarthakdev143.music_video_studio.service.pipeline;

import github.sarthakdev143.music_video_studio.integration.storage.ArtifactStore;
import github.sarthakdev143.music_video_studio.model.AspectRatio;
import github.sarthakdev143.music_video_studio.model.GeneratedMediaItem;
import github.sarthakdev143.music_video_studio.model.MediaKind;
import github.sarthakdev143.music_video_studio.model.PipelineStage;
import github.sarthakdev143.music_video_studio.model.ProductionRequest;
import github.sarthakdev143.music_video_studio.model.Readiness;
import github.sarthakdev143.music_video_studio.model.SceneStatus;
import github.sarthakdev143.music_video_studio.model.StoryboardScene;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
class RegenerationControllerTest {

    @Mock
    private ArtifactStore artifactStore;

    private RegenerationController controller;
    private ProductionSession session;

    @BeforeEach
    void setUp() {
        controller = new RegenerationController(artifactStore);
        session = new ProductionSession(
                "prod-1",
                new ProductionRequest("Song", "Artist", AspectRatio.LANDSCAPE_16_9, "audio"),
                List.of(
                        new StoryboardScene(1, MediaKind.VIDEO, "", "one"),
                        new StoryboardScene(2, MediaKind.VIDEO, "", "two"),
                        new StoryboardScene(3, MediaKind.IMAGE, "", "three")),
                Duration.ofSeconds(61),
                Clock.systemUTC());
    }

    @Test
    void resetsCompletedSceneAndRewindsSession() {
        completeEverything();
        long revision = session.revision();
        session.transition(revision, PipelineStage.INITIAL, PipelineStage.DONE, false);
        session.advanceCursor(revision);
        new CompletionAggregator().evaluate(session);
        session.storeCombinedArtifact(revision, "combined");
        List<GeneratedMediaItem> before = session.sceneTable().snapshot();

        controller.regenerate(session, 2);

        assertThat(session.stage()).isEqualTo(PipelineStage.INITIAL);
        assertThat(session.rotationCursor()).isZero();
        assertThat(session.revision()).isGreaterThan(revision);
        assertThat(session.readiness()).isEqualTo(Readiness.IN_PROGRESS);
        assertThat(session.combinedArtifactHandle()).isNull();
        assertThat(session.sceneTable().find(2)).get()
                .extracting(GeneratedMediaItem::status, GeneratedMediaItem::artifactHandle)
                .containsExactly(SceneStatus.PENDING, null);
        List<GeneratedMediaItem> after = session.sceneTable().snapshot();
        assertThat(after.get(0)).isEqualTo(before.get(0));
        assertThat(after.get(2)).isEqualTo(before.get(2));
        verify(artifactStore).release("clip-2");
        verify(artifactStore).release("combined");
        verify(artifactStore, never()).release("clip-1");
    }

    @Test
    void resetsFailedSceneWithoutReleasingAnything() {
        List<DispatchTicket> tickets = session.sceneTable().markGenerating(session.sceneTable().pending(MediaKind.IMAGE, 20));
        session.sceneTable().merge(List.of(SceneOutcome.failed(tickets.get(0), "Image generation failed.")));

        controller.regenerate(session, 3);

        assertThat(session.sceneTable().find(3)).get()
                .extracting(GeneratedMediaItem::status, GeneratedMediaItem::errorDetail)
                .containsExactly(SceneStatus.PENDING, null);
        verifyNoInteractions(artifactStore);
    }

    @Test
    void rejectsSceneThatIsStillGenerating() {
        session.sceneTable().markGenerating(session.sceneTable().pending(MediaKind.VIDEO, 2));

        assertThatThrownBy(() -> controller.regenerate(session, 1))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("cannot be regenerated yet");
        assertThat(session.revision()).isZero();
    }

    @Test
    void rejectsPendingAndUnknownScenes() {
        assertThatThrownBy(() -> controller.regenerate(session, 1)).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> controller.regenerate(session, 9))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Scene 9 does not exist");
    }

    private void completeEverything() {
        List<DispatchTicket> videos = session.sceneTable().markGenerating(session.sceneTable().pending(MediaKind.VIDEO, 2));
        session.sceneTable().merge(List.of(
                SceneOutcome.succeeded(videos.get(0), "clip-1"),
                SceneOutcome.succeeded(videos.get(1), "clip-2")));
        List<DispatchTicket> images = session.sceneTable().markGenerating(session.sceneTable().pending(MediaKind.IMAGE, 20));
        session.sceneTable().merge(List.of(SceneOutcome.succeeded(images.get(0), "image-3")));
    }
}
