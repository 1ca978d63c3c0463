package net.quay.integration.spring;

import net.quay.adapter.jdbc.JsonCodec;
import net.quay.adapter.jdbc.repo.JdbcBroker;
import net.quay.adapter.jdbc.repo.JdbcResultStore;
import net.quay.adapter.jdbc.repo.JdbcScheduleRepository;
import net.quay.core.spi.Broker;
import net.quay.core.spi.ResultStore;
import net.quay.core.spi.ScheduleRepository;
import net.quay.core.spi.TxRunner;
import net.quay.integration.spring.tx.SpringTxRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.transaction.PlatformTransactionManager;

import javax.sql.DataSource;

/** Oracle 저장소 묶음. DataSource 와 트랜잭션 매니저는 Boot 가 만든 것을 쓴다. */
@Configuration
public class QuaySpringConfig {

    @Bean
    public TxRunner txRunner(PlatformTransactionManager tm, DataSource ds) {
        return new SpringTxRunner(tm, ds);
    }

    @Bean
    public JsonCodec quayJsonCodec() {
        return new JsonCodec();
    }

    // 저장소 구현 등록 (adapter-jdbc 재사용)
    @Bean public Broker broker(DataSource ds, JsonCodec json) { return new JdbcBroker(ds, json); }
    @Bean public ResultStore resultStore(DataSource ds, JsonCodec json) { return new JdbcResultStore(ds, json); }
    @Bean public ScheduleRepository scheduleRepository(DataSource ds, JsonCodec json) { return new JdbcScheduleRepository(ds, json); }
}
