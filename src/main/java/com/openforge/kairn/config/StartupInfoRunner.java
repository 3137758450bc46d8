package com.openforge.kairn.config;

import com.openforge.kairn.experience.ExperienceProperties;
import com.openforge.kairn.graph.GraphProperties;
import com.openforge.kairn.intelligence.WorkspaceProperties;
import com.openforge.kairn.router.RouterProperties;
import com.openforge.kairn.store.StoreProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

import javax.sql.DataSource;
import java.sql.Connection;

/**
 * Prints a structured startup summary after the application context is fully ready.
 *
 * Checks performed:
 *   - Store: opens a real JDBC connection and reads the database version
 *   - Workspace: name, write timeout
 *   - Engines: promotion threshold, prune floor, router limits, auto-link
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StartupInfoRunner implements ApplicationRunner {

    private final DataSource           dataSource;
    private final WorkspaceProperties  workspaceProperties;
    private final StoreProperties      storeProperties;
    private final ExperienceProperties experienceProperties;
    private final RouterProperties     routerProperties;
    private final GraphProperties      graphProperties;
    private final Environment          env;

    @Override
    public void run(ApplicationArguments args) {
        String dbStatus    = probeDatabase();
        String port        = env.getProperty("server.port", "8080");
        String javaVersion = System.getProperty("java.version");

        log.info("""

                ╔══════════════════════════════════════════════════════════╗
                ║              Kairn  —  Startup Summary                   ║
                ╠══════════════════════════════════════════════════════════╣
                ║  Server                                                  ║
                ║    HTTP Port      : {}
                ║    Java Version   : {}
                ╠══════════════════════════════════════════════════════════╣
                ║  Workspace                                               ║
                ║    Name           : {}
                ║    Store          : {}
                ║    Write timeout  : {}
                ╠══════════════════════════════════════════════════════════╣
                ║  Experience                                              ║
                ║    Promote after  : {} accesses
                ║    Prune floor    : {}
                ╠══════════════════════════════════════════════════════════╣
                ║  Router / Graph                                          ║
                ║    Max keywords   : {}  min confidence={}
                ║    Full edges     : {}
                ║    Auto-link      : {}
                ╚══════════════════════════════════════════════════════════╝
                """,
                port,
                javaVersion,

                workspaceProperties.name(),
                dbStatus,
                storeProperties.timeout(),

                experienceProperties.promotionThreshold(),
                experienceProperties.defaultPruneThreshold(),

                routerProperties.maxKeywords(), routerProperties.minConfidence(),
                routerProperties.fullEdgeLimit(),
                graphProperties.autoLink() ? "✔ enabled" : "✘ disabled"
        );
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    /**
     * Opens a real JDBC connection and reads the database version.
     * Returns a one-line summary or error message.
     */
    private String probeDatabase() {
        try (Connection conn = dataSource.getConnection()) {
            String url     = conn.getMetaData().getURL();
            String version = conn.getMetaData().getDatabaseProductVersion();
            return "✔ Connected  version=" + version + "  url=" + maskCredentials(url);
        } catch (Exception e) {
            return "✘ FAILED — " + e.getMessage();
        }
    }

    /** Strips credentials from a JDBC URL for safe logging. */
    static String maskCredentials(String url) {
        if (url == null) return "(unknown)";
        return url.replaceAll("(?i)(password|pwd)=[^&;]*", "$1=***")
                  .replaceAll("//[^/@:]+:[^/@]+@", "//***:***@");
    }
}
