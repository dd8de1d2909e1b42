package com.skybrief.service;

import com.skybrief.core.bus.EventBus;
import com.skybrief.core.events.SourceResolved;
import com.skybrief.core.model.GeoLocation;
import com.skybrief.core.model.Provenance;
import com.skybrief.service.briefing.DailyBriefing;
import com.skybrief.service.briefing.TonightSummary;
import com.skybrief.service.config.ConfigLoader;
import com.skybrief.service.config.EngineConfig;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.DateTimeException;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeParseException;
import java.util.Map;
import java.util.function.Consumer;
import java.util.logging.Logger;

public final class Main {
    private static final Logger LOGGER = Logger.getLogger(Main.class.getName());
    private static final Path DEFAULT_CONFIG = Path.of("config", ConfigLoader.SOURCES_FILE);

    static final String USAGE = "usage: skybrief --lat <deg> --lon <deg> [--at <iso-date-time>] [--offset <+hh:mm>]"
            + " [--elevation <m>] [--config <sources.json>] [--json] [--tonight] [--offline]";

    private Main() {
    }

    public static void main(String[] args) {
        CliOptions options;
        try {
            options = parseArgs(args, System.getenv(), LOGGER::warning);
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            System.err.println(USAGE);
            System.exit(2);
            return;
        }

        EngineConfig config = resolveConfig(options, System.getenv());
        Clock clock = Clock.systemUTC();
        ZonedDateTime at = options.at() != null
                ? options.at()
                : ZonedDateTime.now(clock).withZoneSameInstant(options.location().localOffset());

        EventBus eventBus = new EventBus();
        eventBus.subscribe(SourceResolved.class, event -> {
            if (event.provenance() != Provenance.LIVE) {
                LOGGER.info(event.domain().key() + " resolved as " + event.provenance() + " (" + event.reason() + ")");
            }
        });

        LOGGER.info("Building sky briefing for " + options.location().latitude() + ", " + options.location().longitude() + " at " + at);
        try (BriefingService service = BriefingService.create(config, eventBus, clock)) {
            if (options.tonight()) {
                TonightSummary summary = service.tonight(options.location(), at);
                System.out.println(options.json() ? summary.toJson() : summary.narrative());
            } else {
                DailyBriefing briefing = service.aggregate(options.location(), at);
                System.out.println(options.json() ? briefing.toJson() : briefing.narrative());
            }
        }
        LOGGER.info("Sky briefing complete");
    }

    static EngineConfig resolveConfig(CliOptions options, Map<String, String> env) {
        EngineConfig config;
        if (options.config() != null) {
            config = ConfigLoader.load(options.config());
        } else if (Files.isRegularFile(DEFAULT_CONFIG)) {
            config = ConfigLoader.load(DEFAULT_CONFIG);
        } else {
            config = EngineConfig.defaults();
        }
        config = ConfigLoader.withEnvironment(config, env);
        if (options.offline()) {
            LOGGER.info("Offline mode: every live source is disabled");
            return config.offline();
        }
        return config;
    }

    static CliOptions parseArgs(String[] args, Map<String, String> env, Consumer<String> warn) {
        Double latitude = null;
        Double longitude = null;
        String atRaw = null;
        ZoneOffset offset = null;
        Double elevation = null;
        Path config = null;
        boolean json = false;
        boolean tonight = false;
        boolean offline = ConfigLoader.offlineRequested(env);

        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            switch (arg) {
                case "--lat" -> latitude = number(arg, valueAfter(args, i++));
                case "--lon" -> longitude = number(arg, valueAfter(args, i++));
                case "--at" -> atRaw = valueAfter(args, i++);
                case "--offset" -> offset = offset(valueAfter(args, i++));
                case "--elevation" -> elevation = number(arg, valueAfter(args, i++));
                case "--config" -> config = Path.of(valueAfter(args, i++));
                case "--json" -> json = true;
                case "--tonight" -> tonight = true;
                case "--offline" -> offline = true;
                default -> warn.accept("Ignoring unknown argument " + arg);
            }
        }
        if (latitude == null || longitude == null) {
            throw new IllegalArgumentException("--lat and --lon are required");
        }
        GeoLocation location = new GeoLocation(latitude, longitude, elevation, offset);
        ZonedDateTime at = atRaw == null ? null : instant(atRaw, location.localOffset());
        return new CliOptions(location, at, offset, config, json, tonight, offline);
    }

    private static String valueAfter(String[] args, int index) {
        if (index + 1 >= args.length) {
            throw new IllegalArgumentException(args[index] + " needs a value");
        }
        return args[index + 1];
    }

    private static double number(String flag, String raw) {
        try {
            return Double.parseDouble(raw);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(flag + " expects a number, got '" + raw + "'", e);
        }
    }

    private static ZoneOffset offset(String raw) {
        try {
            return ZoneOffset.of(raw);
        } catch (DateTimeException e) {
            throw new IllegalArgumentException("--offset expects an offset such as -05:00, got '" + raw + "'", e);
        }
    }

    // A date-time without an offset is read in --offset, or in the nautical zone of --lon.
    private static ZonedDateTime instant(String raw, ZoneOffset offset) {
        try {
            return ZonedDateTime.parse(raw);
        } catch (DateTimeParseException ignored) {
            try {
                return LocalDateTime.parse(raw).atZone(offset);
            } catch (DateTimeParseException e) {
                throw new IllegalArgumentException("--at expects an ISO date-time, got '" + raw + "'", e);
            }
        }
    }

    record CliOptions(
            GeoLocation location,
            ZonedDateTime at,
            ZoneOffset offset,
            Path config,
            boolean json,
            boolean tonight,
            boolean offline
    ) {
    }
}
