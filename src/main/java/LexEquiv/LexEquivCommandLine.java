package LexEquiv;

import java.io.IOException;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;

import LexEquiv.Alphabet.AlphabetException;
import LexEquiv.Alphabet.AlphabetPartition;
import LexEquiv.Alphabet.CharUniverse;
import LexEquiv.Automaton.LexerDFA;
import LexEquiv.Model.CheckerOptions;
import LexEquiv.Model.EquivalenceResult;
import LexEquiv.Model.WitnessOrder;
import LexEquiv.Pattern.RuleSyntaxException;
import it.unimi.dsi.fastutil.ints.Int2ObjectMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectRBTreeMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectSortedMap;

public class LexEquivCommandLine {
  static final int EXIT_OK = 0;
  static final int EXIT_ERROR = 1;
  private static final int DUMP_CHARACTER_LIMIT = 10;

  public static void main(String[] args) {
    System.exit(run(args, System.out, System.err));
  }

  /**
   * Parse arguments, compare the first two rule blocks of the input file and print the verdict.
   * @return process exit status
   */
  static int run(String[] args, PrintStream out, PrintStream err) {
    CheckerOptions options = CheckerOptions.defaults();
    boolean dump = false;
    String baPrefix = null;
    List<String> positional = new ArrayList<>(1);

    for (int i = 0; i < args.length; i++) {
      String arg = args[i];
      if ("--debug".equalsIgnoreCase(arg)) {
        SubsetConstruction.DEBUG = true;
        DFAMinimizer.DEBUG = true;
      } else if ("--dump".equalsIgnoreCase(arg)) {
        dump = true;
      } else if ("--no-minimize".equalsIgnoreCase(arg)) {
        options = options.withMinimize(false);
      } else if ("--universe".equalsIgnoreCase(arg) || "--order".equalsIgnoreCase(arg)
          || "--writeBA".equalsIgnoreCase(arg)) {
        // Require a value that isn't another flag
        if (i + 1 >= args.length || args[i + 1].startsWith("-")) {
          err.println("Missing value for " + arg);
          printUsage(err);
          return EXIT_ERROR;
        }
        String value = args[++i]; // consume the value
        if ("--writeBA".equalsIgnoreCase(arg)) {
          baPrefix = value;
        } else if ("--universe".equalsIgnoreCase(arg)) {
          CharUniverse universe = parseUniverse(value);
          if (universe == null) {
            err.println("Unknown universe: " + value);
            return EXIT_ERROR;
          }
          options = options.withUniverse(universe);
        } else {
          WitnessOrder order = parseOrder(value);
          if (order == null) {
            err.println("Unknown witness order: " + value);
            return EXIT_ERROR;
          }
          options = options.withWitnessOrder(order);
        }
      } else if (arg.startsWith("-")) {
        // Unknown flag
        printUsage(err);
        return EXIT_ERROR;
      } else {
        positional.add(arg);
      }
    }

    if (positional.size() != 1) {
      printUsage(err);
      return EXIT_ERROR;
    }

    String source;
    try {
      source = Files.readString(Path.of(positional.get(0)), StandardCharsets.UTF_8);
    } catch (IOException e) {
      err.println("Cannot read " + positional.get(0) + ": " + e.getMessage());
      return EXIT_ERROR;
    }

    List<String> blocks;
    try {
      blocks = BlockExtractor.extract(source);
    } catch (IllegalArgumentException e) {
      err.println(e.getMessage());
      return EXIT_ERROR;
    }
    if (blocks.size() < 2) {
      err.println("Expected two re2c blocks, found " + blocks.size());
      return EXIT_ERROR;
    }

    LexEquivChecker checker = new LexEquivChecker(options);
    LexEquivChecker.Comparison comparison;
    try {
      comparison = checker.compare(blocks.get(0), blocks.get(1));
    } catch (RuleSyntaxException e) {
      err.println("Syntax error at " + e.getLocation() + " (index " + e.getIndex() + "): " + e.getDescription());
      return EXIT_ERROR;
    } catch (AlphabetException e) {
      err.println(e.getMessage() + " (try --universe bmp)");
      return EXIT_ERROR;
    }

    if (dump) {
      dump(out, comparison);
    }
    if (baPrefix != null) {
      try {
        writeBAFiles(out, baPrefix, comparison);
      } catch (UncheckedIOException e) {
        err.println("Cannot write BA files: " + e.getCause().getMessage());
        return EXIT_ERROR;
      }
    }
    printResult(out, comparison.result());
    return EXIT_OK;
  }

  private static void printUsage(PrintStream err) {
    err.println(
        "LexEquiv [--debug] [--dump] [--no-minimize] [--universe byte|bmp] [--order shortlex|lex] "
            + "[--writeBA <prefix>] <input file>");
    err.println("[--debug] : Additional debug/progress output");
    err.println("[--dump] : Print alphabet classes, final states and transitions of both DFAs");
    err.println("[--no-minimize] : Compare the unminimized subset-construction DFAs");
    err.println("[--universe byte|bmp] : Input characters are bytes (default) or UTF-16 code units");
    err.println("[--order shortlex|lex] : Report shortest (default) or lexicographically smallest witnesses;");
    err.println("                         with lex, a witness \"aba\" is reported over a shorter \"ba\"");
    err.println("[--writeBA <prefix>] : Write both DFAs to <prefix>-left.ba and <prefix>-right.ba");
    err.println();
    err.println("<input file> : source file whose first two re2c blocks are compared.");
  }

  private static CharUniverse parseUniverse(String value) {
    return switch (value.toLowerCase()) {
      case "byte" -> CharUniverse.BYTE;
      case "bmp", "utf16" -> CharUniverse.BMP;
      default -> null;
    };
  }

  private static WitnessOrder parseOrder(String value) {
    return switch (value.toLowerCase()) {
      case "shortlex", "short" -> WitnessOrder.SHORTLEX;
      case "lex", "lexicographic" -> WitnessOrder.LEXICOGRAPHIC;
      default -> null;
    };
  }

  private static void dump(PrintStream out, LexEquivChecker.Comparison comparison) {
    AlphabetPartition alphabet = comparison.alphabet();
    out.println("Alphabet classes: " + alphabet.size());
    for (int i = 0; i < alphabet.size(); i++) {
      out.println("\tClass " + i + ": " + alphabet.describeClass(i) + " (" + alphabet.members(i).cardinality()
          + " characters)");
    }
    String[] sides = {"Left", "Right"};
    for (int s = 0; s < 2; s++) {
      LexerDFA dfa = comparison.dfas().get(s);
      out.println();
      out.println(sides[s] + " DFA: " + dfa.size() + " states, " + dfa.getAcceptingStates().cardinality()
          + " accepting, initial state " + dfa.getInitialState());
      dumpTransitions(out, dfa);
    }
    out.println();
  }

  private static void dumpTransitions(PrintStream out, LexerDFA dfa) {
    AlphabetPartition alphabet = dfa.getPartition();
    BitSet accepting = dfa.getAcceptingStates();
    out.println("Final Nodes:");
    for (int q = accepting.nextSetBit(0); q >= 0; q = accepting.nextSetBit(q + 1)) {
      out.println("\tNode " + q);
    }
    out.println("Transitions:");
    for (int q = 0; q < dfa.size(); q++) {
      // classes leading to the same target are merged into one edge
      Int2ObjectSortedMap<BitSet> edges = new Int2ObjectRBTreeMap<>();
      for (int a = 0; a < dfa.numInputs(); a++) {
        int target = dfa.getSuccessor(q, a);
        BitSet chars = edges.get(target);
        if (chars == null) {
          chars = new BitSet();
          edges.put(target, chars);
        }
        chars.or(alphabet.members(a));
      }
      for (Int2ObjectMap.Entry<BitSet> edge : edges.int2ObjectEntrySet()) {
        BitSet chars = edge.getValue();
        out.println("\tFrom " + q + " to " + edge.getIntKey() + ": " + chars.cardinality() + " characters");
        out.println("\t  Characters: " + describeCharacters(chars));
      }
    }
  }

  static String describeCharacters(BitSet chars) {
    StringBuilder sb = new StringBuilder();
    int shown = 0;
    for (int c = chars.nextSetBit(0); c >= 0 && shown < DUMP_CHARACTER_LIMIT; c = chars.nextSetBit(c + 1)) {
      if (shown++ > 0) {
        sb.append(", ");
      }
      sb.append(c);
      if (c >= 0x20 && c < 0x7F) {
        sb.append(" ('").append((char) c).append("')");
      }
    }
    int more = chars.cardinality() - shown;
    if (more > 0) {
      sb.append(", ... (").append(more).append(" more)");
    }
    return sb.toString();
  }

  private static void writeBAFiles(PrintStream out, String prefix, LexEquivChecker.Comparison comparison) {
    String leftFile = prefix + "-left.ba";
    String rightFile = prefix + "-right.ba";
    out.println("Writing to files: " + leftFile + ", " + rightFile);
    BAFormat.writeBAFile(leftFile, comparison.left());
    BAFormat.writeBAFile(rightFile, comparison.right());
  }

  private static void printResult(PrintStream out, EquivalenceResult result) {
    result.onlyLeft().ifPresent(w -> {
      out.println("smallest string accepted by only the first block:");
      out.println(w);
    });
    result.onlyRight().ifPresent(w -> {
      out.println("smallest string accepted by only the second block:");
      out.println(w);
    });
    out.println("DFAs equivalent? " + result.equivalent());
  }
}
