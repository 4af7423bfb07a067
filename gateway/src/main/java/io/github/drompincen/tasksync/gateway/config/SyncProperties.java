package io.github.drompincen.tasksync.gateway.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.List;
import java.util.function.Function;

/**
 * Run options, bound from {@code application.yml}, {@code --tasksync.*} arguments and
 * environment variables.
 */
@Configuration
@ConfigurationProperties(prefix = "tasksync")
public class SyncProperties {

    static final List<String> TOKEN_VARIABLES = List.of("GITHUB_TOKEN", "TASKSMD_GITHUB_TOKEN");

    private String token;
    private String org;
    private int projectNumber;
    private String repo;
    private String repoLabel;
    private String tasksFile;
    private boolean dryRun;
    private boolean writeback;
    private boolean pruneDone;
    private String outputJson;
    private String graphqlUrl = "https://api.github.com/graphql";
    private Duration connectTimeout = Duration.ofSeconds(10);
    private Duration requestTimeout = Duration.ofSeconds(30);

    public String getToken() { return token; }
    public void setToken(String token) { this.token = token; }

    public String getOrg() { return org; }
    public void setOrg(String org) { this.org = org; }

    public int getProjectNumber() { return projectNumber; }
    public void setProjectNumber(int projectNumber) { this.projectNumber = projectNumber; }

    public String getRepo() { return repo; }
    public void setRepo(String repo) { this.repo = repo; }

    public String getRepoLabel() { return repoLabel; }
    public void setRepoLabel(String repoLabel) { this.repoLabel = repoLabel; }

    public String getTasksFile() { return tasksFile; }
    public void setTasksFile(String tasksFile) { this.tasksFile = tasksFile; }

    public boolean isDryRun() { return dryRun; }
    public void setDryRun(boolean dryRun) { this.dryRun = dryRun; }

    public boolean isWriteback() { return writeback; }
    public void setWriteback(boolean writeback) { this.writeback = writeback; }

    public boolean isPruneDone() { return pruneDone; }
    public void setPruneDone(boolean pruneDone) { this.pruneDone = pruneDone; }

    public String getOutputJson() { return outputJson; }
    public void setOutputJson(String outputJson) { this.outputJson = outputJson; }

    public String getGraphqlUrl() { return graphqlUrl; }
    public void setGraphqlUrl(String graphqlUrl) { this.graphqlUrl = graphqlUrl; }

    public Duration getConnectTimeout() { return connectTimeout; }
    public void setConnectTimeout(Duration connectTimeout) { this.connectTimeout = connectTimeout; }

    public Duration getRequestTimeout() { return requestTimeout; }
    public void setRequestTimeout(Duration requestTimeout) { this.requestTimeout = requestTimeout; }

    /**
     * The explicit {@code tasksync.token}, else the first of {@code GITHUB_TOKEN} and
     * {@code TASKSMD_GITHUB_TOKEN} that is set.
     *
     * @return the token, or null when none is configured
     */
    public String resolveToken(Function<String, String> lookup) {
        if (token != null && !token.isBlank()) {
            return token.trim();
        }
        for (String name : TOKEN_VARIABLES) {
            String value = lookup.apply(name);
            if (value != null && !value.isBlank()) {
                return value.trim();
            }
        }
        return null;
    }
}
