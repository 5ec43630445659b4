package im.arun.formulary.util;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.ExecutorService;

import static org.assertj.core.api.Assertions.assertThat;

class ExecutorProviderTest {

    @AfterEach
    void tearDown() {
        ExecutorProvider.shutdown();
    }

    @Test
    void sharesOnePoolUntilShutdown() throws Exception {
        ExecutorService first = ExecutorProvider.getExecutor(2);
        ExecutorService second = ExecutorProvider.getExecutor(8);

        assertThat(second).isSameAs(first);
        String threadName = first.submit(() -> Thread.currentThread().getName()).get();
        assertThat(threadName).startsWith("formulary-worker-");

        ExecutorProvider.shutdown();
        assertThat(first.isShutdown()).isTrue();
        assertThat(ExecutorProvider.getExecutor()).isNotSameAs(first);
    }
}
