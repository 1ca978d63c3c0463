package net.quay.bootstrap.worker;

import net.quay.bootstrap.props.QuayProperties;
import net.quay.core.service.BrokerClient;
import net.quay.core.service.TaskExecutor;
import net.quay.core.service.WorkerOptions;
import net.quay.core.service.WorkerPool;

import java.net.InetAddress;
import java.net.UnknownHostException;

/** 설정값으로 워커 옵션을 만들고, 명령행에서 덮어쓴 옵션으로 풀을 띄운다. */
public class WorkerLauncher {
    private final BrokerClient broker;
    private final TaskExecutor executor;
    private final QuayProperties.Worker config;

    public WorkerLauncher(BrokerClient broker, TaskExecutor executor, QuayProperties.Worker config) {
        this.broker = broker;
        this.executor = executor;
        this.config = config;
    }

    public WorkerOptions defaults() {
        String hostname = config.getHostname() != null ? config.getHostname() : "worker@" + localHostName();
        return WorkerOptions.of(hostname, config.getQueues(), config.getConcurrency())
                .withPrefetch(config.getPrefetch())
                .withPollTimeout(config.getPollTimeout())
                .withVisibilityTimeout(config.getVisibilityTimeout())
                .withShutdownGrace(config.getShutdownGrace());
    }

    /** 풀을 만들고 바로 시작한다. 종료는 호출한 쪽 책임. */
    public WorkerPool start(WorkerOptions options) {
        var pool = new WorkerPool(broker, executor, options);
        pool.start();
        return pool;
    }

    private static String localHostName() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            return "localhost";
        }
    }
}
