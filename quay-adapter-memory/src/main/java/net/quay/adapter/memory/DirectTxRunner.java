package net.quay.adapter.memory;

import net.quay.core.spi.TxRunner;

import java.util.concurrent.Callable;

/** 메모리 저장소용. 각 저장소 메서드가 스스로 원자적이라 트랜잭션 경계는 없다 (롤백도 없음). */
public final class DirectTxRunner implements TxRunner {
    @Override
    public <T> T required(Callable<T> body) throws Exception {
        return body.call();
    }

    @Override
    public <T> T requiresNew(Callable<T> body) throws Exception {
        return body.call();
    }
}
