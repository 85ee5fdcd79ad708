package io.github.yok.sqlserverkit.db;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for {@link CancellationToken}.
 */
class CancellationTokenTest {

    @Test
    void cancel_正常ケース_登録済みのコールバックがある_1回だけ実行されること() {
        CancellationToken token = new CancellationToken();
        AtomicInteger calls = new AtomicInteger();
        token.register(calls::incrementAndGet);

        token.cancel();
        token.cancel();

        assertTrue(token.isCancellationRequested());
        assertEquals(1, calls.get());
    }

    @Test
    void register_正常ケース_キャンセル済みのトークンに登録する_即座に実行されること() {
        CancellationToken token = new CancellationToken();
        token.cancel();
        AtomicInteger calls = new AtomicInteger();

        token.register(calls::incrementAndGet);

        assertEquals(1, calls.get());
    }

    @Test
    void register_正常ケース_登録を解除する_キャンセル時に実行されないこと() {
        CancellationToken token = new CancellationToken();
        AtomicInteger calls = new AtomicInteger();
        CancellationToken.Registration registration = token.register(calls::incrementAndGet);

        registration.close();
        token.cancel();

        assertEquals(0, calls.get());
    }

    @Test
    void cancel_正常ケース_コールバックが例外を送出する_後続のコールバックも実行されること() {
        CancellationToken token = new CancellationToken();
        AtomicInteger calls = new AtomicInteger();
        token.register(() -> {
            throw new IllegalStateException("callback failed");
        });
        token.register(calls::incrementAndGet);

        assertDoesNotThrow(token::cancel);
        assertEquals(1, calls.get());
    }

    @Test
    void throwIfCancellationRequested_異常ケース_キャンセル済み_CancellationExceptionが送出されること() {
        CancellationToken token = new CancellationToken();
        assertDoesNotThrow(token::throwIfCancellationRequested);
        token.cancel();
        assertThrows(CancellationException.class, token::throwIfCancellationRequested);
    }

    @Test
    void NONE_異常ケース_キャンセルする_UnsupportedOperationExceptionが送出されること() {
        assertThrows(UnsupportedOperationException.class, CancellationToken.NONE::cancel);
        assertFalse(CancellationToken.NONE.isCancellationRequested());
        assertDoesNotThrow(() -> CancellationToken.NONE.register(() -> {
        }).close());
    }

    @Test
    void await_正常ケース_キャンセルされない_指定時間経過後に戻ること() {
        CancellationToken token = new CancellationToken();
        long start = System.nanoTime();
        token.await(Duration.ofMillis(50));
        assertTrue(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start) >= 45);
    }

    @Test
    void await_異常ケース_待機中にキャンセルされる_CancellationExceptionが送出されること()
            throws Exception {
        CancellationToken token = new CancellationToken();
        CompletableFuture<Void> canceller = CompletableFuture.runAsync(() -> {
            sleep(50);
            token.cancel();
        });

        long start = System.nanoTime();
        assertThrows(CancellationException.class, () -> token.await(Duration.ofSeconds(30)));
        assertTrue(TimeUnit.NANOSECONDS.toSeconds(System.nanoTime() - start) < 10,
                "キャンセル後すぐに待機が解除されること");
        canceller.get(5, TimeUnit.SECONDS);
    }

    @Test
    void await_異常ケース_割り込まれる_CancellationExceptionが送出され割り込み状態が復元されること() {
        CancellationToken token = new CancellationToken();
        Thread.currentThread().interrupt();
        try {
            CancellationException ex = assertThrows(CancellationException.class,
                    () -> token.await(Duration.ofSeconds(30)));
            assertInstanceOf(InterruptedException.class, ex.getCause());
            assertTrue(Thread.currentThread().isInterrupted());
        } finally {
            // 割り込み状態を後続テストへ持ち越さない
            Thread.interrupted();
        }
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
