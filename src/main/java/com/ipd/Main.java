package com.ipd;

import static picocli.CommandLine.Command;
import static picocli.CommandLine.Option;

import com.google.common.base.Stopwatch;
import com.ipd.match.Contestant;
import com.ipd.match.Match;
import com.ipd.match.MatchSetup;
import com.ipd.match.Round;
import com.ipd.model.Player;
import com.ipd.model.PlayerType;
import com.ipd.output.Formatter;
import com.ipd.parser.MatchParser;
import com.ipd.parser.TransformerParser;
import com.ipd.strategy.BasicStrategies;
import com.ipd.transformer.HistoryTrackingWrapper;
import com.ipd.transformer.TransformedStrategy;
import java.io.BufferedOutputStream;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.annotation.Nullable;
import picocli.CommandLine;

@Command(
    name = "ipd-transform",
    mixinStandardHelpOptions = true,
    version = "IPD Strategy Transformers 0.1",
    description = "Plays a match between two strategies, each optionally transformed")
public final class Main implements Callable<Integer> {
    private static final Logger log = Logger.getLogger(Main.class.getName());

    private static PrintStream open(String output) throws IOException {
        return "-".equals(output)
            ? System.out
            : new PrintStream(new BufferedOutputStream(Files.newOutputStream(Path.of(output))));
    }

    @Nullable
    @Option(
        names = {"--config"},
        description = "Match description in JSON format, overrides all other match options")
    private String config;

    @Option(
        names = {"--player"},
        description = "Base strategy of the first player, default: ${DEFAULT-VALUE}")
    private String player = "TitForTat";

    @Option(
        names = {"--opponent"},
        description = "Base strategy of the second player, default: ${DEFAULT-VALUE}")
    private String opponent = "Cooperator";

    @Option(
        names = {"-t", "--transform"},
        description = "Transformer for the first player, applied in the given order (e.g. flip, noisy:0.1, initial:DDC)")
    private List<String> transformers = List.of();

    @Option(
        names = {"--opponent-transform"},
        description = "Transformer for the second player, applied in the given order")
    private List<String> opponentTransformers = List.of();

    @Option(
        names = {"--turns"},
        description = "Number of turns, default: ${DEFAULT-VALUE}")
    private int turns = MatchParser.DEFAULT_TURNS;

    @Nullable
    @Option(
        names = {"--seed"},
        description = "Seed for the random sources of both players")
    private Long seed;

    @Option(
        names = {"--hide-length"},
        description = "Do not tell the players the number of turns")
    private boolean hideLength = false;

    @Option(
        names = {"--list"},
        description = "List the available base strategies and exit")
    private boolean list = false;

    @Option(
        names = {"-O", "--output"},
        description = "Write the match to the given file, - for stdout")
    private String writeOutput = "-";

    private Main() {}

    public static void main(String[] args) {
        System.exit(execute(args));
    }

    static int execute(String... args) {
        return new CommandLine(new Main()).execute(args);
    }

    private MatchSetup setup() throws IOException {
        if (config != null) {
            try (BufferedReader reader = Files.newBufferedReader(Path.of(config))) {
                return MatchParser.parse(reader);
            }
        }
        return new MatchSetup(
            new Contestant(BasicStrategies.byIdentifier(player), TransformerParser.parseAll(transformers)),
            new Contestant(BasicStrategies.byIdentifier(opponent), TransformerParser.parseAll(opponentTransformers)),
            turns, !hideLength, seed);
    }

    @Override
    public Integer call() throws Exception {
        try (var stream = open(writeOutput)) {
            if (list) {
                BasicStrategies.all().stream()
                    .map(type -> "%s (%s)".formatted(type.identifier(), type.name()))
                    .forEach(stream::println);
                return 0;
            }

            Stopwatch timer = Stopwatch.createStarted();
            MatchSetup setup = setup();
            Match match = setup.newMatch();
            log.log(Level.INFO, () -> "Playing %s against %s"
                .formatted(match.first().name(), match.second().name()));
            List<Round> rounds = match.play();
            log.log(Level.INFO, () -> "Match took %s".formatted(timer));

            print(stream, match.first(), Formatter.formatFirst(rounds));
            print(stream, match.second(), Formatter.formatSecond(rounds));
        }
        return 0;
    }

    private static void print(PrintStream stream, Player player, String moves) {
        PlayerType type = player.type();
        stream.println("%s [%s]: %s".formatted(type.name(), type.identifier(), moves));
        TransformedStrategy.findWrapper(player, HistoryTrackingWrapper.class)
            .ifPresent(tracker -> stream.println("  tracked: " + Formatter.format(tracker.recordedHistory())));
    }
}
