package net.quay.core.spi;

import net.quay.core.model.TaskError;
import net.quay.core.model.TaskResult;

import java.time.Instant;
import java.util.Optional;

/** 태스크 id별 상태. 쓰기는 키 단위로 원자적이며 여러 키에 걸치는 연산은 없다. */
public interface ResultStore {
    void createPending(TaskResult pending) throws Exception;

    /** 모르는 id이거나 {@code now} 기준 만료면 empty. */
    Optional<TaskResult> find(String taskId, Instant now) throws Exception;

    /**
     * PENDING (워커가 죽어 재전달된 경우 PROGRESS) -> PROGRESS, 진행률은 0으로 초기화.
     * 이미 터미널이면 (REVOKED 포함) false.
     */
    boolean markStarted(String taskId, int attempt, Instant startedAt) throws Exception;

    /**
     * PROGRESS이고 지금 도는 attempt일 때만 반영한다. 버려진 시도의 보고는 무시.
     * 한 시도 안에서 저장된 진행률은 줄지 않는다.
     */
    void updateProgress(String taskId, int attempt, int progress, String message) throws Exception;

    /** 재시도가 브로커에서 대기하는 동안 PROGRESS -> PENDING. */
    void markRetrying(String taskId, String message) throws Exception;

    /**
     * 터미널 전이. SUCCESS는 진행률도 100으로. 이미 SUCCESS/FAILURE면 건드리지 않는다.
     */
    void complete(String taskId, TaskResult.State state, Object result, TaskError error,
                  Instant finishedAt, Instant expiresAt) throws Exception;

    /** PENDING -> REVOKED. 다른 상태면 false. */
    boolean revoke(String taskId, Instant now) throws Exception;

    /** PROGRESS 엔트리에 협조적 취소 플래그를 세운다. */
    boolean requestCancel(String taskId) throws Exception;

    void delete(String taskId) throws Exception;

    /** expiresAt이 지난 터미널 엔트리 삭제. */
    int purgeExpired(Instant now) throws Exception;
}
