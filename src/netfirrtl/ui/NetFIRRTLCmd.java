package netfirrtl.ui;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.Writer;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;
import netfirrtl.NetFIRRTL;
import netfirrtl.backend.NetlistLoweringException;
import netfirrtl.frontend.YosysJsonReader;
import netfirrtl.netlist.Design;
import netfirrtl.util.FileWriter;
import org.apache.commons.cli.*;
import org.apache.logging.log4j.*;
import org.apache.logging.log4j.core.appender.*;
import org.apache.logging.log4j.core.config.Configurator;
import org.apache.logging.log4j.core.config.builder.api.*;
import org.apache.logging.log4j.core.config.builder.impl.*;
import org.yaml.snakeyaml.error.YAMLException;

public class NetFIRRTLCmd {
  // logging
  protected static Logger logger = null;

  // options for cmdline parser
  static Options options = new Options();

  // object and function for help text generation
  private static HelpFormatter helper = new HelpFormatter();
  private static void printHelpAndExit(Options options) {
    helper.printHelp("netfirrtl [options] <netlist.json> [output.fir] - lower a Yosys JSON netlist to FIRRTL", options);
    System.exit(-1);
  };

  // entrypoint
  public static void main(String[] args) {
    // initialize logging
    // get builder to create new appender
    ConfigurationBuilder<BuiltConfiguration> builder = ConfigurationBuilderFactory.newConfigurationBuilder();
    // generate appender for stderr writing, stdout may carry the circuit
    AppenderComponentBuilder appenderBuilder =
        builder.newAppender("Stderr", "CONSOLE").addAttribute("target", ConsoleAppender.Target.SYSTEM_ERR);
    // set printing layout
    appenderBuilder.add(builder.newLayout("PatternLayout").addAttribute("pattern", "%-5level: %msg%n%throwable"));
    // create the appender and root logger for the defined pattern
    builder.add(appenderBuilder);
    builder.add(builder.newRootLogger(Level.OFF).add(builder.newAppenderRef("Stderr")));
    // initialize logging and generate logger for current class
    Configurator.initialize(builder.build());
    logger = LogManager.getLogger();

    CommandLineParser parser = new DefaultParser();

    options.addOption(Option.builder("o")
                          .longOpt("output")
                          .argName("output.fir")
                          .hasArg()
                          .required(false)
                          .desc("FIRRTL file to write; standard output by default")
                          .build());
    options.addOption(Option.builder("t")
                          .longOpt("top")
                          .argName("module")
                          .hasArg()
                          .required(false)
                          .desc("Top module of the circuit; defaults to the module with the top attribute, else the last module")
                          .build());
    options.addOption(Option.builder("s")
                          .longOpt("select")
                          .argName("m1,m2,...")
                          .hasArg()
                          .required(false)
                          .desc("Modules to write; the selection must cover the whole design")
                          .build());
    options.addOption(Option.builder("c")
                          .longOpt("config")
                          .argName("config.yaml")
                          .hasArg()
                          .required(false)
                          .desc("YAML file with lowering options")
                          .build());
    options.addOption(Option.builder("h").longOpt("help").required(false).desc("Print this message").build());
    options.addOption(Option.builder("q").longOpt("quiet").required(false).desc("Turn off all messages").build());
    options.addOption(Option.builder("v").longOpt("verbose").required(false).desc("Verbose printing").build());
    options.addOption(Option.builder("vv").longOpt("vverbose").required(false).desc("Print debug information and enable -v").build());

    //////////   collect options   //////////
    String inputFile = "";
    String outputFile = FileWriter.STDOUT;
    String top = null;
    List<String> selection = null;
    NetFIRRTLConfig cfg = new NetFIRRTLConfig();
    try {
      // parse the command line arguments
      CommandLine line = parser.parse(options, args);

      // print help if requested
      if (line.hasOption("h")) {
        printHelpAndExit(options);
      }

      List<String> positional = line.getArgList();
      if (positional.isEmpty() || positional.size() > 2) {
        System.err.println("Expected an input netlist and at most one output file");
        printHelpAndExit(options);
      }
      inputFile = positional.get(0);
      if (positional.size() == 2)
        outputFile = positional.get(1);
      if (line.hasOption("o"))
        outputFile = line.getOptionValue("o");
      top = line.getOptionValue("t");
      if (line.hasOption("s"))
        selection = Arrays.stream(line.getOptionValue("s").split(",")).map(String::trim).filter(s -> !s.isEmpty()).collect(Collectors.toList());

      // set verbosity of printing
      Level logLvl = Level.INFO;
      if (line.hasOption("q"))
        logLvl = Level.OFF;
      if (line.hasOption("v"))
        logLvl = Level.DEBUG;
      if (line.hasOption("vv"))
        logLvl = Level.TRACE;
      Configurator.setAllLevels(LogManager.getRootLogger().getName(), logLvl);

      if (line.hasOption("c"))
        cfg = parseConfig(new File(line.getOptionValue("c")));
    } catch (ParseException exp) {
      // parsing failed - raise error to user
      System.err.println(exp.getMessage());
      printHelpAndExit(options);
    }

    ///////// check options are not empty /////////
    assert inputFile != null && !inputFile.isEmpty() : "No input netlist selected!";

    //////////   read the netlist   //////////
    Design design = null;
    try {
      design = new YosysJsonReader().read(new File(inputFile));
    } catch (IOException e) {
      logger.fatal("Netlist " + inputFile + " could not be read: " + e.getMessage());
      System.exit(1);
    }
    if (design.modules().isEmpty()) {
      System.err.println("Netlist " + inputFile + " contains no modules");
      printHelpAndExit(options);
    }
    if (selection != null)
      design.select(selection);
    if (!design.isFullySelected()) {
      System.err.println("The FIRRTL backend can only write fully selected designs");
      printHelpAndExit(options);
    }
    if (top != null) {
      try {
        design.setTopModule(top);
      } catch (IllegalArgumentException e) {
        System.err.println(e.getMessage());
        printHelpAndExit(options);
      }
    }

    //////////   invoke the lowering   //////////
    NetFIRRTL lowering = new NetFIRRTL(cfg);
    boolean success = true;
    try (Writer out = new FileWriter().OpenOutput(outputFile)) {
      lowering.Write(design, out);
    } catch (NetlistLoweringException e) {
      logger.fatal(e.getMessage());
      success = false;
    } catch (IOException e) {
      logger.fatal("Error writing " + outputFile + ": " + e.getMessage());
      success = false;
    }
    if (!lowering.GetWarnings().isEmpty())
      logger.info("{} warning(s) reported", lowering.GetWarnings().size());

    System.exit(success ? 0 : 1);
  }

  static NetFIRRTLConfig parseConfig(File configFile) {
    try (InputStream readFile = new FileInputStream(configFile)) {
      return NetFIRRTLConfig.load(readFile);
    } catch (IOException e) {
      logger.error("Config file " + configFile + " could not be opened");
      printHelpAndExit(options);
    } catch (YAMLException e) {
      logger.error("Invalid config file " + configFile + ": " + e.getMessage());
      printHelpAndExit(options);
    }
    return null;
  }
}
