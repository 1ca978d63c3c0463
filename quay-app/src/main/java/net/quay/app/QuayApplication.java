package net.quay.app;

import net.quay.app.cli.QuayCli;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * quay-app worker --queues=high_priority,default --concurrency=4 --hostname=w1
 * quay-app beat
 */
@SpringBootApplication
@EnableScheduling
public class QuayApplication {

    public static void main(String[] args) {
        System.exit(QuayCli.run(QuayApplication.class, args));
    }
}
