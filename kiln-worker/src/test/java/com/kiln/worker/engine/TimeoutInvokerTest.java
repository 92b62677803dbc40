package com.kiln.worker.engine;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.io.IOException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TimeoutInvokerTest {

    @AfterEach
    void clearMdc() {
        MDC.clear();
    }

    @Test
    void invoke_returnsTheResultAndCarriesTheMdc() throws Exception {
        MDC.put("linkId", "plan");

        String seen = TimeoutInvoker.invoke(() -> MDC.get("linkId") + "@" + Thread.currentThread().getName(),
                5, "kiln-link-plan");

        assertEquals("plan@kiln-link-plan", seen);
    }

    @Test
    void invoke_rethrowsTheWorkException() {
        IOException e = assertThrows(IOException.class, () -> TimeoutInvoker.invoke(() -> {
            throw new IOException("disk gone");
        }, 5, "kiln-link-io"));

        assertEquals("disk gone", e.getMessage());
    }

    @Test
    void invoke_interruptsWorkThatOverrunsTheBudget() throws Exception {
        CountDownLatch interrupted = new CountDownLatch(1);

        assertThrows(TimeoutException.class, () -> TimeoutInvoker.invoke(() -> {
            try {
                Thread.sleep(30_000);
            } catch (InterruptedException e) {
                interrupted.countDown();
                throw e;
            }
            return null;
        }, 1, "kiln-link-slow"));

        assertTrue(interrupted.await(5, TimeUnit.SECONDS));
    }
}
