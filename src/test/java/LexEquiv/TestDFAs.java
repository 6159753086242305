package LexEquiv;

import LexEquiv.Alphabet.AlphabetPartition;
import LexEquiv.Alphabet.AlphabetPartitioner;
import LexEquiv.Alphabet.CharUniverse;
import LexEquiv.Automaton.LexerDFA;
import LexEquiv.Automaton.ThompsonBuilder;
import LexEquiv.Pattern.Pattern;
import LexEquiv.Pattern.RuleParser;
import LexEquiv.Pattern.RuleSyntaxException;

import java.util.ArrayList;
import java.util.List;

public class TestDFAs {
    // Only for tests: compiles blocks over one joint partition, unminimized
    public static List<LexerDFA> compile(CharUniverse universe, String... blocks) {
        List<Pattern> trees = new ArrayList<>(blocks.length);
        for (String block : blocks) {
            try {
                trees.add(RuleParser.compileBlock(block));
            } catch (RuleSyntaxException e) {
                throw new IllegalArgumentException(block, e);
            }
        }
        return build(AlphabetPartitioner.partition(universe, trees), trees);
    }

    public static List<LexerDFA> compile(String... blocks) {
        return compile(CharUniverse.BYTE, blocks);
    }

    public static List<LexerDFA> build(AlphabetPartition partition, List<Pattern> trees) {
        List<LexerDFA> result = new ArrayList<>(trees.size());
        for (Pattern tree : trees) {
            result.add(SubsetConstruction.determinize(ThompsonBuilder.build(tree, partition), partition));
        }
        return result;
    }
}
