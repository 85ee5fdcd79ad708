package io.github.yok.sqlserverkit.db;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import java.sql.SQLException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for {@link Retry}.
 */
class RetryTest {

    @Test
    void execute_正常ケース_初回で成功する_結果が返り監視関数が呼ばれないこと() throws Exception {
        List<SQLException> observed = new ArrayList<>();
        RetryPolicy policy = RetryPolicy.of(2, 1).withExceptionObserver(observed::add);

        String result = Retry.execute("test", () -> "ok", policy, CancellationToken.NONE);

        assertEquals("ok", result);
        assertEquals(0, observed.size());
    }

    @Test
    void execute_正常ケース_2回失敗後に成功する_3回目の結果が返ること() throws Exception {
        AtomicInteger attempts = new AtomicInteger();
        List<SQLException> observed = new ArrayList<>();
        RetryPolicy policy = RetryPolicy.of(3, 1).withExceptionObserver(observed::add);

        int result = Retry.execute("test", () -> {
            if (attempts.incrementAndGet() < 3) {
                throw new SQLException("locked");
            }
            return attempts.get();
        }, policy, CancellationToken.NONE);

        assertEquals(3, result);
        assertEquals(2, observed.size());
    }

    @Test
    void execute_異常ケース_常に失敗する_リトライ回数プラス1回試行後に元の例外が送出されること() {
        AtomicInteger attempts = new AtomicInteger();
        List<SQLException> observed = new ArrayList<>();
        RetryPolicy policy = RetryPolicy.of(2, 1).withExceptionObserver(observed::add);
        SQLException failure = new SQLException("database in use");

        SQLException ex = assertThrows(SQLException.class,
                () -> Retry.execute("test", () -> {
                    attempts.incrementAndGet();
                    throw failure;
                }, policy, CancellationToken.NONE));

        assertSame(failure, ex, "例外はラップされずにそのまま送出されること");
        assertEquals(3, attempts.get());
        assertEquals(3, observed.size(), "最後の失敗も監視関数へ通知されること");
    }

    @Test
    void execute_異常ケース_リトライ0回で失敗する_1回だけ試行されること() {
        AtomicInteger attempts = new AtomicInteger();
        RetryPolicy policy = RetryPolicy.of(0, 1);

        assertThrows(SQLException.class, () -> Retry.execute("test", () -> {
            attempts.incrementAndGet();
            throw new SQLException("boom");
        }, policy, CancellationToken.NONE));

        assertEquals(1, attempts.get());
    }

    @Test
    void execute_異常ケース_開始前にキャンセル済み_一度も試行されないこと() {
        CancellationToken token = new CancellationToken();
        token.cancel();
        AtomicInteger attempts = new AtomicInteger();

        assertThrows(CancellationException.class, () -> Retry.execute("test", () -> {
            attempts.incrementAndGet();
            return null;
        }, RetryPolicy.DEFAULT, token));

        assertEquals(0, attempts.get());
    }

    @Test
    void execute_異常ケース_失敗中にキャンセルされる_SQL例外より優先してCancellationExceptionが送出されること() {
        CancellationToken token = new CancellationToken();
        List<SQLException> observed = new ArrayList<>();
        RetryPolicy policy = RetryPolicy.of(5, 1).withExceptionObserver(observed::add);
        SQLException failure = new SQLException("The query was canceled.");

        CancellationException ex = assertThrows(CancellationException.class,
                () -> Retry.execute("test", () -> {
                    token.cancel();
                    throw failure;
                }, policy, token));

        assertSame(failure, ex.getCause());
        assertEquals(0, observed.size());
    }

    @Test
    void execute_異常ケース_リトライ待機中にキャンセルされる_CancellationExceptionが送出されること() {
        CancellationToken token = new CancellationToken();
        AtomicInteger attempts = new AtomicInteger();
        RetryPolicy policy = new RetryPolicy(5, Duration.ofSeconds(30), e -> token.cancel());

        long start = System.nanoTime();
        assertThrows(CancellationException.class, () -> Retry.execute("test", () -> {
            attempts.incrementAndGet();
            throw new SQLException("boom");
        }, policy, token));

        assertEquals(1, attempts.get());
        assertTrue(System.nanoTime() - start < Duration.ofSeconds(10).toNanos(),
                "待機はキャンセルで中断されること");
    }
}
