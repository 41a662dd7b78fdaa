package com.prreview.orchestrator.queue;

import org.junit.jupiter.api.Test;

import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

class ProgressRegistryTest {

    final ProgressRegistry registry = new ProgressRegistry();
    final UUID taskId = UUID.randomUUID();

    @Test
    void publish_thenFind_returnsLatestStep() {
        registry.publish(taskId, 1, 4, "Initializing GitHub analyzer");
        registry.publish(taskId, 2, 4, "Fetching PR data");

        assertThat(registry.find(taskId)).hasValueSatisfying(p -> {
            assertThat(p.current()).isEqualTo(2);
            assertThat(p.total()).isEqualTo(4);
            assertThat(p.phase()).isEqualTo("Fetching PR data");
            assertThat(p.terminal()).isFalse();
        });
    }

    @Test
    void complete_removesEntry() {
        registry.publish(taskId, 4, 4, "Saving results");

        registry.complete(taskId);

        assertThat(registry.find(taskId)).isEmpty();
        assertThat(registry.latest(taskId)).isEmpty();
    }

    @Test
    void fail_leavesTerminalNoticeThatIsNotLiveProgress() {
        registry.publish(taskId, 2, 4, "Fetching PR data");

        registry.fail(taskId, "GitHub API error: HTTP 404");

        assertThat(registry.find(taskId)).isEmpty();
        assertThat(registry.latest(taskId)).hasValueSatisfying(p -> {
            assertThat(p.terminal()).isTrue();
            assertThat(p.phase()).isEqualTo("GitHub API error: HTTP 404");
        });
    }

    @Test
    void unknownTask_hasNoProgress() {
        assertThat(registry.find(UUID.randomUUID())).isEmpty();
    }
}
