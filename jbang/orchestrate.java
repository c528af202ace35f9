///usr/bin/env jbang "$0" "$@" ; exit $?
//JAVA 17
//REPOS central=https://repo1.maven.org/maven2/
//DEPS org.springaicommunity:github-orchestrator-cli:1.0.0-SNAPSHOT

import org.springaicommunity.github.orchestrator.cli.OrchestratorCli;

public class orchestrate {
    public static void main(String[] args) {
        OrchestratorCli.main(args);
    }
}
