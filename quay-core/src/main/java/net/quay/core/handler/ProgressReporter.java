package net.quay.core.handler;

public interface ProgressReporter {
    /** 퍼센트는 0..100으로 자르고, 같은 시도 안에서 이전 보고보다 내려가지 않는다. */
    void report(int percent, String message);

    default void report(long done, long total, String message) {
        int percent = total <= 0 ? 100 : (int) Math.min(100, (done * 100) / total);
        report(percent, message);
    }

    /** 실행 중에 클라이언트가 revoke를 요청했으면 true. */
    boolean isCancellationRequested();

    /** 이번 시도에서 지금까지 보고된 최댓값. */
    int current();

    ProgressReporter NOOP = new ProgressReporter() {
        @Override public void report(int percent, String message) { }
        @Override public boolean isCancellationRequested() { return false; }
        @Override public int current() { return 0; }
    };
}
