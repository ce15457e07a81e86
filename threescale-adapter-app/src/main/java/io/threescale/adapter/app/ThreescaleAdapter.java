/*
 * Copyright Threescale Adapter Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.threescale.adapter.app;

import java.util.concurrent.Callable;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.threescale.adapter.AdapterBootstrap;
import io.threescale.adapter.ResolvedConfig;
import io.threescale.adapter.VersionInfo;
import io.threescale.adapter.config.Settings;
import io.threescale.adapter.lifecycle.LifecycleController;

import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Adapter application entrypoint.  All configuration comes from {@code THREESCALE_*} environment variables.
 */
@Command(name = "threescale-adapter", mixinStandardHelpOptions = true, versionProvider = ThreescaleAdapter.VersionProvider.class, description = "Authorization adapter for 3scale API Management")
public class ThreescaleAdapter implements Callable<Integer> {

    private static final Logger LOGGER = LoggerFactory.getLogger("io.threescale.adapter.StartupShutdownLogger");

    private final Supplier<Settings> settingsSupplier;
    private final ControllerBuilder controllerBuilder;

    interface ControllerBuilder {
        LifecycleController build(Settings settings);
    }

    ThreescaleAdapter() {
        this(Settings::fromEnvironment, ThreescaleAdapter::newController);
    }

    ThreescaleAdapter(Supplier<Settings> settingsSupplier, ControllerBuilder controllerBuilder) {
        this.settingsSupplier = settingsSupplier;
        this.controllerBuilder = controllerBuilder;
    }

    private static LifecycleController newController(Settings settings) {
        ResolvedConfig resolved = new AdapterBootstrap(VersionInfo.VERSION_INFO).resolve(settings);
        return new LifecycleController(settings, resolved, VersionInfo.VERSION_INFO);
    }

    @Override
    public Integer call() throws Exception {
        Settings settings = settingsSupplier.get();
        try {
            LoggingConfigurator.configure(settings);
            printVersions();
            controllerBuilder.build(settings).run();
        }
        catch (Exception e) {
            LOGGER.error("Fatal: {}", e.getMessage(), e);
            throw e;
        }
        return 0;
    }

    private static void printVersions() {
        for (String version : new VersionProvider().getVersion()) {
            LOGGER.info("{}", version);
        }
        LOGGER.atInfo()
                .setMessage("Platform: Java {}({}) running on {} {}/{}")
                .addArgument(Runtime::version)
                .addArgument(() -> System.getProperty("java.vendor"))
                .addArgument(() -> System.getProperty("os.name"))
                .addArgument(() -> System.getProperty("os.version"))
                .addArgument(() -> System.getProperty("os.arch"))
                .log();
    }

    /**
     * Adapter entry point
     * @param args args
     */
    public static void main(String... args) {
        int exitCode = new CommandLine(new ThreescaleAdapter()).execute(args);
        System.exit(exitCode);
    }

    static class VersionProvider implements CommandLine.IVersionProvider {
        @Override
        public String[] getVersion() {
            return new String[]{ "threescale-adapter: " + VersionInfo.VERSION_INFO.version() };
        }
    }
}
