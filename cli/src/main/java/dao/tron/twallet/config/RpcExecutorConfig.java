package dao.tron.twallet.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Thread pool for blocking chain calls. Jobs submitted to a worker wrap their RPC calls
 * in futures running here, so the worker lanes only wait and never block on I/O themselves.
 */
@Configuration
public class RpcExecutorConfig {

    public static final String RPC_EXECUTOR = "rpc-executor";

    @Bean(name = RPC_EXECUTOR)
    public ThreadPoolTaskExecutor rpcExecutor(RpcProperties rpcProps) {
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(rpcProps.getMaxConcurrentCalls());
        e.setMaxPoolSize(rpcProps.getMaxConcurrentCalls());
        e.setAllowCoreThreadTimeOut(true);
        e.setThreadNamePrefix("rpc-");
        e.initialize();
        return e;
    }
}
