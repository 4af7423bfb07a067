package io.github.drompincen.tasksync.gateway.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.tasksync.gateway.github.GitHubProjectClient;
import io.github.drompincen.tasksync.gateway.github.GraphQlTransport;
import io.github.drompincen.tasksync.runtime.board.BoardClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;

import java.net.URI;
import java.net.http.HttpClient;

/**
 * Wires the GitHub board client. Nothing here talks to the network: the project id and
 * fields are resolved on first use, after the runner has validated the options.
 */
@Configuration
public class BoardClientConfig {

    @Bean
    GraphQlTransport graphQlTransport(SyncProperties properties, Environment environment, ObjectMapper objectMapper) {
        HttpClient httpClient = HttpClient.newBuilder()
                .connectTimeout(properties.getConnectTimeout())
                .build();
        String token = properties.resolveToken(environment::getProperty);
        return new GraphQlTransport(httpClient, URI.create(properties.getGraphqlUrl()),
                token != null ? token : "", properties.getRequestTimeout(), objectMapper);
    }

    @Bean
    BoardClient boardClient(GraphQlTransport transport, SyncProperties properties) {
        return new GitHubProjectClient(transport, properties.getOrg(), properties.getProjectNumber());
    }
}
