package net.quay.core.handler;

/**
 * 등록된 태스크의 본문. 정상 반환하면 반환값을 결과로 SUCCESS,
 * 예외를 던지면 재시도 정책이 판단한다.
 */
@FunctionalInterface
public interface TaskHandler {
    Object handle(TaskCall call, ProgressReporter progress) throws Exception;
}
