package net.quay.app.cli;

import net.quay.bootstrap.worker.WorkerLauncher;
import net.quay.core.error.BrokerUnavailableException;
import net.quay.core.service.BrokerClient;
import net.quay.core.service.WorkerOptions;
import net.quay.core.service.WorkerPool;
import net.quay.integration.spring.sched.QuaySchedulers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.DefaultApplicationArguments;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.context.ConfigurableApplicationContext;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CountDownLatch;

/**
 * 명령행 진입점. 첫 인자가 명령(worker | beat), 나머지는 --옵션=값.
 * 점이 들어간 옵션(--quay.results.ttl=2h 등)은 스프링 프로퍼티로 그대로 넘긴다.
 *
 * <p>종료 코드: 0 정상 종료, 1 시작 실패(잘못된 인자, 브로커 연결 불가), 2 모르는 명령.
 */
public final class QuayCli {
    private static final Logger log = LoggerFactory.getLogger(QuayCli.class);

    public static final int EXIT_OK = 0;
    public static final int EXIT_FATAL = 1;
    public static final int EXIT_UNKNOWN_COMMAND = 2;

    static final String USAGE = """
            usage: quay-app <command> [options]
              worker [--queues=a,b] [--concurrency=n] [--hostname=id] [--prefetch=n]
              beat
            any --some.property=value is passed to Spring as a configuration property""";

    public enum Command { WORKER, BEAT }

    /** 짧은 옵션 -> 프로퍼티 키 */
    private static final Map<Command, Map<String, String>> OPTIONS = Map.of(
            Command.WORKER, Map.of(
                    "queues", "quay.worker.queues",
                    "concurrency", "quay.worker.concurrency",
                    "hostname", "quay.worker.hostname",
                    "prefetch", "quay.worker.prefetch"),
            Command.BEAT, Map.of());

    public record Invocation(Command command, List<String> springArgs) {}

    public static final class UnknownCommandException extends RuntimeException {
        UnknownCommandException(String message) { super(message); }
    }

    private QuayCli() {}

    public static int run(Class<?> source, String[] args) {
        Invocation inv;
        try {
            inv = parse(args);
        } catch (UnknownCommandException e) {
            log.error("{}\n{}", e.getMessage(), USAGE);
            return EXIT_UNKNOWN_COMMAND;
        } catch (IllegalArgumentException e) {
            log.error("Bad arguments: {}\n{}", e.getMessage(), USAGE);
            return EXIT_FATAL;
        }

        var app = new SpringApplication(source);
        app.setWebApplicationType(WebApplicationType.NONE);
        app.setRegisterShutdownHook(false); // 종료 순서는 아래 훅에서 직접 관리

        ConfigurableApplicationContext ctx;
        try {
            ctx = app.run(inv.springArgs().toArray(String[]::new));
        } catch (RuntimeException e) {
            log.error("Startup failed: {}", e.getMessage());
            return EXIT_FATAL;
        }

        // SIGTERM/SIGINT: 훅은 신호만 주고, 정리가 끝날 때까지 JVM 종료를 붙잡는다
        CountDownLatch stopRequested = new CountDownLatch(1);
        CountDownLatch finished = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            stopRequested.countDown();
            awaitQuietly(finished);
        }, "quay-shutdown"));

        try (ctx) {
            return inv.command() == Command.WORKER
                    ? runWorker(ctx, stopRequested)
                    : runBeat(ctx, stopRequested);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return EXIT_OK;
        } finally {
            finished.countDown();
        }
    }

    public static Invocation parse(String[] args) {
        if (args.length == 0 || args[0].startsWith("--")) {
            throw new UnknownCommandException("No command given");
        }
        Command command;
        try {
            command = Command.valueOf(args[0].toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new UnknownCommandException("Unknown command: " + args[0]);
        }

        String[] rest = List.of(args).subList(1, args.length).toArray(String[]::new);
        var parsed = new DefaultApplicationArguments(rest);
        if (!parsed.getNonOptionArgs().isEmpty()) {
            throw new IllegalArgumentException("Unexpected arguments: " + parsed.getNonOptionArgs());
        }

        List<String> springArgs = new ArrayList<>();
        Map<String, String> known = OPTIONS.get(command);
        for (String name : parsed.getOptionNames()) {
            List<String> values = parsed.getOptionValues(name);
            if (values.size() != 1) {
                throw new IllegalArgumentException("--" + name + " needs exactly one value");
            }
            String value = values.get(0);
            if (known.containsKey(name)) {
                validate(name, value);
                springArgs.add("--" + known.get(name) + "=" + value);
            } else if (name.contains(".")) {
                springArgs.add("--" + name + "=" + value);
            } else {
                throw new IllegalArgumentException("Unknown option for " + args[0] + ": --" + name);
            }
        }
        if (command == Command.BEAT) {
            springArgs.add("--quay.beat.enabled=true");
        }
        return new Invocation(command, List.copyOf(springArgs));
    }

    private static void validate(String name, String value) {
        switch (name) {
            case "concurrency", "prefetch" -> {
                int n;
                try {
                    n = Integer.parseInt(value);
                } catch (NumberFormatException e) {
                    throw new IllegalArgumentException("--" + name + " must be a number: " + value);
                }
                if (n < 1) throw new IllegalArgumentException("--" + name + " must be >= 1: " + value);
            }
            case "queues", "hostname" -> {
                if (value.isBlank()) throw new IllegalArgumentException("--" + name + " must not be blank");
            }
            default -> { }
        }
    }

    static int runWorker(ConfigurableApplicationContext ctx, CountDownLatch stop) throws InterruptedException {
        if (!brokerReachable(ctx)) return EXIT_FATAL;

        WorkerLauncher launcher = ctx.getBean(WorkerLauncher.class);
        WorkerOptions options = launcher.defaults();
        WorkerPool pool = launcher.start(options);

        stop.await();
        // 새 메시지 수신 중단 -> 실행 중 태스크 대기(grace) -> 미처리 메시지 반환
        pool.shutdown(options.shutdownGrace());
        return EXIT_OK;
    }

    static int runBeat(ConfigurableApplicationContext ctx, CountDownLatch stop) throws InterruptedException {
        if (!brokerReachable(ctx)) return EXIT_FATAL;

        QuaySchedulers schedulers = ctx.getBeanProvider(QuaySchedulers.class).getIfAvailable();
        if (schedulers == null || !schedulers.isBeatEnabled()) {
            log.error("beat needs quay.scheduler.enabled=true");
            return EXIT_FATAL;
        }

        log.info("Beat running");
        stop.await();
        schedulers.setBeatEnabled(false);
        return EXIT_OK;
    }

    private static boolean brokerReachable(ConfigurableApplicationContext ctx) {
        try {
            ctx.getBean(BrokerClient.class).ping();
            return true;
        } catch (BrokerUnavailableException e) {
            log.error("Broker unreachable: {}", e.getMessage());
            return false;
        }
    }

    private static void awaitQuietly(CountDownLatch latch) {
        try {
            latch.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
