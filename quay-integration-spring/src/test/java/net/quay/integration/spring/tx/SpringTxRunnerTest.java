package net.quay.integration.spring.tx;

import net.quay.adapter.jdbc.TxContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;

import javax.sql.DataSource;
import java.io.IOException;
import java.sql.Connection;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.*;

class SpringTxRunnerTest {

    DataSource ds;
    Connection outer;
    Connection inner;
    SpringTxRunner tx;

    @BeforeEach
    void setUp() throws Exception {
        ds = mock(DataSource.class);
        outer = mock(Connection.class);
        inner = mock(Connection.class);
        when(ds.getConnection()).thenReturn(outer, inner);
        tx = new SpringTxRunner(new DataSourceTransactionManager(ds), ds);
    }

    @AfterEach
    void clear() {
        TxContext.clear();
    }

    @Test
    void required_binds_connection_and_commits() throws Exception {
        Connection seen = tx.required(TxContext::require);

        assertThat(seen).isSameAs(outer);
        assertThat(TxContext.get()).isNull();
        verify(outer).commit();
        verify(outer, never()).rollback();
    }

    @Test
    void nested_required_joins_outer_connection() throws Exception {
        Connection seen = tx.required(() -> tx.required(TxContext::require));

        assertThat(seen).isSameAs(outer);
        verify(ds, times(1)).getConnection();
    }

    @Test
    void requires_new_uses_fresh_connection_and_restores_outer() throws Exception {
        tx.required(() -> {
            Connection fresh = tx.requiresNew(TxContext::require);
            assertThat(fresh).isSameAs(inner);
            assertThat(TxContext.get()).isSameAs(outer);
            return null;
        });

        verify(inner).commit();
        verify(outer).commit();
    }

    @Test
    void checked_exception_rolls_back_and_is_rethrown_as_is() throws Exception {
        assertThatThrownBy(() -> tx.required(() -> { throw new IOException("disk"); }))
                .isInstanceOf(IOException.class)
                .hasMessage("disk");

        verify(outer).rollback();
        verify(outer, never()).commit();
        assertThat(TxContext.get()).isNull();
    }
}
