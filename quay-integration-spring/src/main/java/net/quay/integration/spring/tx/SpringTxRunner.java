package net.quay.integration.spring.tx;

import net.quay.adapter.jdbc.TxContext;
import net.quay.core.spi.TxRunner;
import org.springframework.jdbc.datasource.DataSourceUtils;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;
import java.sql.Connection;
import java.util.concurrent.Callable;

/**
 * 스프링 트랜잭션 위에서 {@link TxContext} 를 채워 주는 TxRunner.
 * 저장소는 스프링을 모르고 TxContext 커넥션만 쓴다.
 */
public final class SpringTxRunner implements TxRunner {
    private final TransactionTemplate required;
    private final TransactionTemplate requiresNew;
    private final DataSource ds;

    public SpringTxRunner(PlatformTransactionManager tm, DataSource ds) {
        this.required = template(tm, TransactionDefinition.PROPAGATION_REQUIRED);
        this.requiresNew = template(tm, TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        this.ds = ds;
    }

    private static TransactionTemplate template(PlatformTransactionManager tm, int propagation) {
        var tpl = new TransactionTemplate(tm);
        tpl.setPropagationBehavior(propagation);
        return tpl;
    }

    @Override
    public <T> T required(Callable<T> body) throws Exception {
        return execute(required, false, body);
    }

    @Override
    public <T> T requiresNew(Callable<T> body) throws Exception {
        return execute(requiresNew, true, body);
    }

    private <T> T execute(TransactionTemplate tpl, boolean fresh, Callable<T> body) throws Exception {
        Connection suspended = TxContext.get();
        try {
            return tpl.execute(status -> {
                // REQUIRED 중첩 호출이면 이미 꽂힌 커넥션 그대로 사용
                if (!fresh && suspended != null) return call(body);

                // 스프링 트랜잭션의 물리 커넥션을 끌어와 TxContext에 꽂아줌
                Connection con = DataSourceUtils.getConnection(ds);
                try {
                    TxContext.set(con);
                    return call(body);
                } finally {
                    TxContext.clear();
                    DataSourceUtils.releaseConnection(con, ds); // 스프링이 관리하는 방식으로 반납
                }
            });
        } catch (CheckedBodyException e) {
            throw e.getCause();
        } finally {
            if (suspended != null) TxContext.set(suspended);
        }
    }

    private static <T> T call(Callable<T> body) {
        try {
            return body.call();
        } catch (RuntimeException re) {
            throw re;
        } catch (Exception e) {
            // 체크 예외도 롤백시키고, 템플릿 밖에서 원래 예외로 되돌린다
            throw new CheckedBodyException(e);
        }
    }

    private static final class CheckedBodyException extends RuntimeException {
        CheckedBodyException(Exception cause) { super(cause); }

        @Override
        public synchronized Exception getCause() { return (Exception) super.getCause(); }
    }
}
