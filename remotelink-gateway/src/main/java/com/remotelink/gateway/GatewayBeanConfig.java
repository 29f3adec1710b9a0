package com.remotelink.gateway;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.remotelink.common.config.ConfigService;
import com.remotelink.common.config.RemoteLinkConfig;
import com.remotelink.common.infra.CommandExecutor;
import com.remotelink.common.infra.SystemInfoProvider;
import com.remotelink.gateway.auth.SessionManager;
import com.remotelink.gateway.command.CommandAction;
import com.remotelink.gateway.command.CommandCatalog;
import com.remotelink.gateway.dispatch.RequestDispatcher;
import com.remotelink.gateway.handler.EndpointHandler;
import com.remotelink.gateway.handler.HandlerCatalog;
import com.remotelink.gateway.registry.EndpointRegistry;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.util.stream.Collectors;

/**
 * Spring configuration for Gateway beans.
 */
@Configuration
public class GatewayBeanConfig {

    @Value("${remotelink.config.path:~/.remotelink/config.json}")
    private String configPath;

    @Bean
    public ConfigService configService() {
        return new ConfigService(Path.of(configPath));
    }

    @Bean
    public SessionManager sessionManager(ConfigService configService) {
        return new SessionManager(configService);
    }

    @Bean(destroyMethod = "shutdown")
    public CommandExecutor commandExecutor(ConfigService configService) {
        return new CommandExecutor(configService.loadConfig().getExec());
    }

    @Bean
    public SystemInfoProvider systemInfoProvider(ConfigService configService) {
        return new SystemInfoProvider(() -> configService.loadConfig().getClient().getName());
    }

    @Bean
    public HandlerCatalog handlerCatalog(ObjectProvider<EndpointHandler> handlers) {
        return new HandlerCatalog(handlers.orderedStream().collect(Collectors.toList()));
    }

    @Bean
    public EndpointRegistry endpointRegistry(ConfigService configService, HandlerCatalog handlerCatalog,
            ObjectMapper objectMapper) {
        RemoteLinkConfig.RegistryConfig registry = configService.loadConfig().getRegistry();
        return new EndpointRegistry(Path.of(registry.getEndpointsDir()), handlerCatalog, objectMapper);
    }

    @Bean
    public CommandCatalog commandCatalog(ConfigService configService, ObjectProvider<CommandAction> actions,
            CommandExecutor commandExecutor, ObjectMapper objectMapper) {
        RemoteLinkConfig.RegistryConfig registry = configService.loadConfig().getRegistry();
        return new CommandCatalog(Path.of(registry.getCommandsDir()),
                actions.orderedStream().collect(Collectors.toList()), commandExecutor, objectMapper);
    }

    @Bean
    public RequestDispatcher requestDispatcher(EndpointRegistry endpointRegistry, SessionManager sessionManager) {
        return new RequestDispatcher(endpointRegistry, sessionManager);
    }
}
