package github.sarthakdev143.music_video_studio.service.pipeline;

import github.sarthakdev143.music_video_studio.config.PipelineExecutionConfig;
import github.sarthakdev143.music_video_studio.config.PipelineProperties;
import github.sarthakdev143.music_video_studio.integration.generation.GenerationException;
import github.sarthakdev143.music_video_studio.integration.generation.GenerationFailureType;
import github.sarthakdev143.music_video_studio.integration.storage.ArtifactStore;
import github.sarthakdev143.music_video_studio.model.GeneratedMediaItem;
import github.sarthakdev143.music_video_studio.model.MediaKind;
import github.sarthakdev143.music_video_studio.model.SceneStatus;
import github.sarthakdev143.music_video_studio.model.StoryboardScene;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
class BatchExecutorTest {

    @Mock
    private ArtifactStore artifactStore;

    private final TaskExecutor directExecutor = Runnable::run;

    @Test
    void recordsEverySceneOfTheBatchWithItsOwnOutcome() {
        SceneTable table = new SceneTable(List.of(video(1), video(2)));
        BatchExecutor executor = new BatchExecutor(directExecutor, artifactStore);

        BatchReport report = executor.execute(table, MediaKind.VIDEO, "veo-fast", List.of(video(1), video(2)), scene -> {
            if (scene.sceneNumber() == 2) {
                throw new GenerationException(GenerationFailureType.QUOTA_EXCEEDED, "Quota exceeded for veo-fast.");
            }
            return "clip-" + scene.sceneNumber();
        });

        assertThat(report.dispatched()).isEqualTo(2);
        assertThat(report.completed()).isEqualTo(1);
        assertThat(report.failed()).isEqualTo(1);
        assertThat(report.backendId()).isEqualTo("veo-fast");
        assertThat(item(table, 1).artifactHandle()).isEqualTo("clip-1");
        assertThat(item(table, 2).status()).isEqualTo(SceneStatus.FAILED);
        assertThat(item(table, 2).errorDetail()).isEqualTo("Quota exceeded for veo-fast.");
    }

    @Test
    void noResultIsWrittenUntilTheWholeBatchHasSettled() {
        SceneTable table = new SceneTable(List.of(image(1), image(2), image(3)));
        BatchExecutor executor = new BatchExecutor(directExecutor, artifactStore);
        List<SceneStatus> seenWhileGenerating = new ArrayList<>();

        executor.execute(table, MediaKind.IMAGE, null, table.pending(MediaKind.IMAGE, 20), scene -> {
            table.snapshot().forEach(item -> seenWhileGenerating.add(item.status()));
            return "image-" + scene.sceneNumber();
        });

        assertThat(seenWhileGenerating).hasSize(9).containsOnly(SceneStatus.GENERATING);
        assertThat(table.allComplete()).isTrue();
    }

    @Test
    void failureWithoutMessageFallsBackToUnknownError() {
        SceneTable table = new SceneTable(List.of(image(1)));
        BatchExecutor executor = new BatchExecutor(directExecutor, artifactStore);

        executor.execute(table, MediaKind.IMAGE, null, List.of(image(1)), scene -> {
            throw new IllegalStateException();
        });

        assertThat(item(table, 1).errorDetail()).isEqualTo("An unknown error occurred.");
    }

    @Test
    void blankHandleCountsAsFailure() {
        SceneTable table = new SceneTable(List.of(image(1)));
        BatchExecutor executor = new BatchExecutor(directExecutor, artifactStore);

        executor.execute(table, MediaKind.IMAGE, null, List.of(image(1)), scene -> " ");

        assertThat(item(table, 1).status()).isEqualTo(SceneStatus.FAILED);
        assertThat(item(table, 1).errorDetail()).contains("returned no artifact");
    }

    @Test
    void rejectedDispatchMarksWholeBatchFailedAndThrows() {
        SceneTable table = new SceneTable(List.of(video(1), video(2), video(3)));
        TaskExecutor rejecting = task -> {
            throw new TaskRejectedException("generation pool is full");
        };
        BatchExecutor executor = new BatchExecutor(rejecting, artifactStore);

        assertThatThrownBy(() -> executor.execute(
                        table,
                        MediaKind.VIDEO,
                        "veo",
                        List.of(video(1), video(2)),
                        scene -> "never"))
                .isInstanceOf(CatastrophicDispatchException.class)
                .hasMessageContaining("generation pool is full")
                .satisfies(error -> assertThat(((CatastrophicDispatchException) error).failedScenes()).isEqualTo(2));

        assertThat(item(table, 1).status()).isEqualTo(SceneStatus.FAILED);
        assertThat(item(table, 2).status()).isEqualTo(SceneStatus.FAILED);
        assertThat(item(table, 3).status()).isEqualTo(SceneStatus.PENDING);
        assertThat(table.hasUnsettled()).isTrue();
        verifyNoInteractions(artifactStore);
    }

    @Test
    void fullImageBatchRunsOnASingleThreadGenerationPool() {
        PipelineProperties properties = new PipelineProperties(2, 20, Duration.ofSeconds(61), List.of("veo"), false, 1);
        ThreadPoolTaskExecutor generationPool = new PipelineExecutionConfig().generationTaskExecutor(properties);
        List<StoryboardScene> images = IntStream.rangeClosed(1, 20).mapToObj(BatchExecutorTest::image).toList();
        SceneTable table = new SceneTable(images);
        BatchExecutor executor = new BatchExecutor(generationPool, artifactStore);

        try {
            BatchReport report = executor.execute(table, MediaKind.IMAGE, null, table.pending(MediaKind.IMAGE, 20), scene -> {
                Thread.sleep(20);
                return "image-" + scene.sceneNumber();
            });

            assertThat(report.dispatched()).isEqualTo(20);
            assertThat(report.completed()).isEqualTo(20);
            assertThat(table.count(SceneStatus.COMPLETE)).isEqualTo(20);
            verifyNoInteractions(artifactStore);
        } finally {
            generationPool.shutdown();
        }
    }

    @Test
    void emptyBatchDoesNothing() {
        SceneTable table = new SceneTable(List.of(video(1)));
        BatchExecutor executor = new BatchExecutor(directExecutor, artifactStore);

        BatchReport report = executor.execute(table, MediaKind.VIDEO, "veo", List.of(), scene -> "never");

        assertThat(report.dispatched()).isZero();
        assertThat(item(table, 1).status()).isEqualTo(SceneStatus.PENDING);
    }

    private GeneratedMediaItem item(SceneTable table, int sceneNumber) {
        return table.find(sceneNumber).orElseThrow();
    }

    private static StoryboardScene video(int sceneNumber) {
        return new StoryboardScene(sceneNumber, MediaKind.VIDEO, "", "video " + sceneNumber);
    }

    private static StoryboardScene image(int sceneNumber) {
        return new StoryboardScene(sceneNumber, MediaKind.IMAGE, "", "image " + sceneNumber);
    }
}
