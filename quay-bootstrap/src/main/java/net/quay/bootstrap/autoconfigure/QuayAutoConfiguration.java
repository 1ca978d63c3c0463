package net.quay.bootstrap.autoconfigure;

import net.quay.adapter.memory.DirectTxRunner;
import net.quay.adapter.memory.InMemoryBroker;
import net.quay.adapter.memory.InMemoryResultStore;
import net.quay.adapter.memory.InMemoryScheduleRepository;
import net.quay.bootstrap.beat.ScheduleRegistrar;
import net.quay.bootstrap.props.QuayProperties;
import net.quay.bootstrap.worker.WorkerLauncher;
import net.quay.core.handler.ExecutionContext;
import net.quay.core.maintenance.MaintenanceService;
import net.quay.core.service.*;
import net.quay.core.spi.*;
import net.quay.integration.spring.QuaySpringConfig;
import net.quay.integration.spring.cron.CronUtilsCalculator;
import net.quay.integration.spring.sched.QuaySchedulers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.autoconfigure.jdbc.DataSourceTransactionManagerAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;

import javax.sql.DataSource;
import java.time.ZoneId;

@AutoConfiguration(after = {DataSourceAutoConfiguration.class, DataSourceTransactionManagerAutoConfiguration.class})
@EnableConfigurationProperties(QuayProperties.class)
public class QuayAutoConfiguration {
    private static final Logger log = LoggerFactory.getLogger(QuayAutoConfiguration.class);

    // --- 저장소: quay.store.type 으로 선택 ---

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnProperty(prefix = "quay.store", name = "type", havingValue = "jdbc", matchIfMissing = true)
    @Import(QuaySpringConfig.class) // integration-spring: 저장소/트랜잭션 조립
    static class JdbcStoreConfiguration {
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnProperty(prefix = "quay.store", name = "type", havingValue = "memory")
    static class MemoryStoreConfiguration {
        @Bean @ConditionalOnMissingBean public TxRunner txRunner() { return new DirectTxRunner(); }
        @Bean @ConditionalOnMissingBean public Broker broker(Clock clock) { return new InMemoryBroker(clock); }
        @Bean @ConditionalOnMissingBean public ResultStore resultStore() { return new InMemoryResultStore(); }
        @Bean @ConditionalOnMissingBean public ScheduleRepository scheduleRepository() { return new InMemoryScheduleRepository(); }
    }

    // --- SPI 기본 구현(없으면) 제공 ---

    @Bean
    @ConditionalOnMissingBean(Clock.class)
    public Clock systemClock() {
        return Clock.system();
    }

    @Bean
    @ConditionalOnMissingBean(CronCalculator.class)
    public CronCalculator cronCalculator() {
        return new CronUtilsCalculator();
    }

    // --- 코어 서비스 조립 ---

    @Bean
    @ConditionalOnMissingBean
    public TaskRegistry taskRegistry(ObjectProvider<TaskDefinition> definitions, QuayProperties props) {
        var builder = TaskRegistry.builder();
        definitions.orderedStream().forEach(def -> {
            var o = props.getTasks().get(def.name());
            builder.register(o == null ? def : def.withOverrides(o.getQueue(), o.getMaxRetries(), o.getTimeLimit()));
        });
        for (String name : props.getTasks().keySet()) {
            if (definitions.stream().noneMatch(d -> d.name().equals(name))) {
                log.warn("quay.tasks.{} configured but no such task is defined", name);
            }
        }
        return builder.build();
    }

    @Bean
    @ConditionalOnMissingBean
    public TaskRouter taskRouter(QuayProperties props) {
        return new TaskRouter(props.getRoutes());
    }

    @Bean
    @ConditionalOnMissingBean
    public BrokerClient brokerClient(Broker broker, TxRunner tx, QuayProperties props) {
        return new BrokerClient(broker, tx, props.getBroker().getPollInterval());
    }

    @Bean
    @ConditionalOnMissingBean
    public TaskClient taskClient(TaskRegistry registry, BrokerClient broker, ResultStore results,
                                 TxRunner tx, Clock clock, TaskRouter router) {
        return new TaskClient(registry, broker, results, tx, clock, router);
    }

    @Bean
    @ConditionalOnMissingBean
    public ExecutionContext executionContext(ObjectProvider<DataSource> dataSource) {
        var ctx = ExecutionContext.builder();
        dataSource.ifAvailable(ds -> ctx.with(DataSource.class, ds));
        return ctx.build();
    }

    @Bean
    @ConditionalOnMissingBean
    public RetryPolicyEngine retryPolicyEngine() {
        return new RetryPolicyEngine();
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    public TaskExecutor taskExecutor(TaskRegistry registry, BrokerClient broker, ResultStore results,
                                     TxRunner tx, Clock clock, RetryPolicyEngine retry,
                                     ExecutionContext context, QuayProperties props) {
        return new TaskExecutor(registry, broker, results, tx, clock, retry, context,
                props.getResults().getTtl());
    }

    @Bean
    @ConditionalOnMissingBean
    public WorkerLauncher workerLauncher(BrokerClient broker, TaskExecutor executor, QuayProperties props) {
        return new WorkerLauncher(broker, executor, props.getWorker());
    }

    @Bean
    @ConditionalOnMissingBean
    public BeatService beatService(ScheduleRepository schedules, TaskClient client, TxRunner tx,
                                   Clock clock, CronCalculator cron, QuayProperties props) {
        return new BeatService(schedules, client, tx, clock, cron, ZoneId.of(props.getZone()));
    }

    @Bean
    @ConditionalOnMissingBean
    public MaintenanceService maintenance(Broker broker, ResultStore results, TxRunner tx, Clock clock) {
        return new MaintenanceService(broker, results, tx, clock);
    }

    // --- 스케줄러 등록 (@Scheduled 딜레이는 quay.beat.tick-delay-ms / quay.maintenance.delay-ms) ---

    @Bean
    @ConditionalOnProperty(prefix = "quay.scheduler", name = "enabled", havingValue = "true", matchIfMissing = true)
    public QuaySchedulers quaySchedulers(BeatService beat, MaintenanceService maintenance, QuayProperties props) {
        var s = new QuaySchedulers(beat, maintenance);
        s.setBeatEnabled(props.getBeat().isEnabled());
        s.setBeatLease(props.getBeat().getLease());
        s.setOwner(props.getBeat().getOwner());
        s.setMaintenanceEnabled(props.getMaintenance().isEnabled());
        return s;
    }

    @Bean
    @ConditionalOnMissingBean
    public ScheduleRegistrar scheduleRegistrar(BeatService beat, TaskRegistry registry) {
        return new ScheduleRegistrar(beat, registry);
    }

    @Bean
    @ConditionalOnProperty(prefix = "quay.beat", name = "enabled", havingValue = "true")
    public ApplicationRunner scheduleRunner(ScheduleRegistrar registrar, QuayProperties props) {
        log.info("Beat schedule: {}", props.getBeat().getEntries());
        return args -> registrar.register(props.getBeat());
    }
}
