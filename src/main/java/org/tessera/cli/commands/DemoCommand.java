package org.tessera.cli.commands;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigValueFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tessera.cli.CommandLineInterface;
import org.tessera.cli.rendering.AsciiTileRenderer;
import org.tessera.cli.rendering.JsonTileRenderer;
import org.tessera.config.ConfigLoader;
import org.tessera.runtime.api.TileLayout;
import org.tessera.runtime.api.TileLayoutException;
import org.tessera.runtime.spi.ITileRenderer;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.util.concurrent.Callable;

/**
 * Builds a layout, fills it with sample items and prints the resulting tiles.
 * <p>
 * All rows but the last two get one unit item per cell, a 2x2 item goes to the
 * bottom rows starting at column 1, and a last item is placed at the bottom-left
 * cell and removed again.
 */
@Command(
    name = "demo",
    description = "Fill a layout with sample items and print its tiles"
)
public class DemoCommand implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(DemoCommand.class);

    private static final String[] GREETINGS = {
        "Hello", "Salut", "Hallo", "Hola", "Ciao", "Ola", "Hej", "Saluton", "Szia"
    };

    @Option(
        names = {"-f", "--format"},
        description = "Output format: ascii, json (default: ascii)"
    )
    private String format = "ascii";

    @Option(
        names = {"--rows"},
        description = "Number of rows (default: from configuration)"
    )
    private Integer rows;

    @Option(
        names = {"--columns"},
        description = "Number of columns (default: from configuration)"
    )
    private Integer columns;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        ITileRenderer<String> renderer = createRenderer(format);
        if (renderer == null) {
            err.println("Unknown format '" + format + "', expected ascii or json");
            return 1;
        }

        Config layoutConfig = ConfigLoader.layoutSection(parent.getConfig());
        if (rows != null) {
            layoutConfig = layoutConfig.withValue("rowCount", ConfigValueFactory.fromAnyRef(rows));
        }
        if (columns != null) {
            layoutConfig = layoutConfig.withValue("columnCount", ConfigValueFactory.fromAnyRef(columns));
        }
        if (layoutConfig.getInt("rowCount") < 2 || layoutConfig.getInt("columnCount") < 3) {
            err.println("The demo needs at least 2 rows and 3 columns");
            return 1;
        }

        try {
            TileLayout<String> layout = new TileLayout<>(layoutConfig);
            populate(layout);
            out.print(renderer.render(layout));
            out.flush();
            return 0;
        } catch (TileLayoutException e) {
            err.println("Demo failed: " + e.getMessage());
            return 1;
        }
    }

    /**
     * Runs the sample scenario on an empty layout.
     */
    static void populate(TileLayout<String> layout) throws TileLayoutException {
        int rowCount = layout.rowCount();
        int columnCount = layout.columnCount();
        int index = 0;
        for (int row = 0; row < rowCount - 2; row++) {
            for (int column = 0; column < columnCount; column++) {
                layout.place(sampleItem(index++), row, column);
            }
        }
        layout.place(sampleItem(index++), rowCount - 2, 1, 2, 2);

        String last = sampleItem(index);
        layout.place(last, rowCount - 1, 0);
        layout.remove(last);
        LOG.debug("Demo layout holds {} items in {} tiles", layout.items().size(), layout.tiles().size());
    }

    static String sampleItem(int index) {
        return GREETINGS[index % GREETINGS.length] + "-" + index;
    }

    private static ITileRenderer<String> createRenderer(String format) {
        return switch (format.toLowerCase()) {
            case "ascii" -> new AsciiTileRenderer<>();
            case "json" -> new JsonTileRenderer<>();
            default -> null;
        };
    }
}
