package me.golemcore.memory.testsupport;

import java.util.concurrent.ExecutorService;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.mock;

/**
 * Executor stand-ins that run submitted tasks on the calling thread.
 */
public final class DirectExecutors {

    private DirectExecutors() {
    }

    public static ExecutorService sameThread() {
        ExecutorService executor = mock(ExecutorService.class);
        doAnswer(invocation -> {
            Runnable task = invocation.getArgument(0);
            task.run();
            return null;
        }).when(executor).execute(any(Runnable.class));
        return executor;
    }
}
