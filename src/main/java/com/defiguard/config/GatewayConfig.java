package com.defiguard.config;

import com.defiguard.audit.AuditLog;
import com.defiguard.auth.InvocationTokenService;
import com.defiguard.exception.ConfigurationException;
import com.defiguard.gateway.ToolCallDriver;
import com.defiguard.gateway.ToolInvocationGateway;
import com.defiguard.governance.GovernancePipeline;
import com.defiguard.observability.GovernanceMetrics;
import com.defiguard.tool.ArgumentBinder;
import com.defiguard.tool.Network;
import com.defiguard.tool.ToolRegistry;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ThreadPoolExecutor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Tool executor, invocation tokens and the gateway.
 *
 * <p>Properties prefixes: {@code defiguard.gateway.*}, {@code defiguard.auth.*},
 * {@code defiguard.executor.*}
 */
@Configuration
public class GatewayConfig {

    @Value("${defiguard.executor.core-pool-size:4}")
    private int corePoolSize;

    @Value("${defiguard.executor.max-pool-size:16}")
    private int maxPoolSize;

    @Value("${defiguard.executor.queue-capacity:64}")
    private int queueCapacity;

    @Bean("toolExecutor")
    public ThreadPoolTaskExecutor toolExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(corePoolSize);
        executor.setMaxPoolSize(maxPoolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("tool-");
        // saturation surfaces as an execution error, never runs a tool on the request thread
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        return executor;
    }

    @Bean
    public ToolCallDriver toolCallDriver(
            ThreadPoolTaskExecutor toolExecutor,
            @Value("${defiguard.gateway.call-timeout:30s}") Duration callTimeout,
            @Value("${defiguard.gateway.max-steps:16}") int maxSteps) {
        if (callTimeout.isNegative() || callTimeout.isZero()) {
            throw new ConfigurationException("defiguard.gateway.call-timeout must be positive");
        }
        if (maxSteps < 1) {
            throw new ConfigurationException("defiguard.gateway.max-steps must be at least 1");
        }
        return new ToolCallDriver(toolExecutor.getThreadPoolExecutor(), callTimeout, maxSteps);
    }

    @Bean
    public InvocationTokenService invocationTokenService(
            @Value("${defiguard.auth.invocation-secret}") String secret,
            @Value("${defiguard.auth.token-ttl:15m}") Duration tokenTtl,
            Clock clock) {
        return new InvocationTokenService(secret, tokenTtl, clock);
    }

    @Bean
    public ToolInvocationGateway toolInvocationGateway(
            InvocationTokenService invocationTokenService,
            ToolRegistry toolRegistry,
            ArgumentBinder argumentBinder,
            GovernancePipeline governancePipeline,
            ToolCallDriver toolCallDriver,
            AuditLog auditLog,
            GovernanceMetrics governanceMetrics,
            @Value("${defiguard.gateway.default-network:ethereum}") String defaultNetwork,
            Clock clock) {
        Network network = Network.fromWireName(defaultNetwork)
                .orElseThrow(() -> new ConfigurationException(
                        "Unknown defiguard.gateway.default-network '" + defaultNetwork + "'"));
        return new ToolInvocationGateway(
                invocationTokenService,
                toolRegistry,
                argumentBinder,
                governancePipeline,
                toolCallDriver,
                auditLog,
                governanceMetrics,
                network,
                clock);
    }
}
