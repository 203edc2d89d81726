package com.agentmux;

import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.context.ApplicationListener;
import org.springframework.context.event.ContextClosedEvent;

import java.util.concurrent.CountDownLatch;

@SpringBootApplication
public class AgentmuxApplication {

    public static void main(String[] args) throws InterruptedException {
        CountDownLatch closed = new CountDownLatch(1);

        new SpringApplicationBuilder(AgentmuxApplication.class)
                .properties(
                        "spring.main.web-application-type=none",
                        "spring.main.banner-mode=off"
                )
                .listeners(new ApplicationListener<ContextClosedEvent>() {
                    @Override
                    public void onApplicationEvent(ContextClosedEvent event) {
                        closed.countDown();
                    }
                })
                .run(args);

        // Session threads are daemons and there is no web server; hold the JVM until shutdown.
        closed.await();
    }
}
