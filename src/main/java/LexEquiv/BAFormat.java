package LexEquiv;

import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;

import LexEquiv.Automaton.LexerDFA;
import net.automatalib.automaton.fsa.impl.CompactDFA;
import net.automatalib.serialization.ba.BAWriter;

public class BAFormat {
    /*
    Input symbols in the written file are alphabet class indices, see AlphabetPartition for their characters.
     */
    public static void writeBA(OutputStream os, LexerDFA dfa) throws IOException {
        final CompactDFA<Integer> automaton = dfa.getAutomaton();
        BAWriter<Integer> baWriter = new BAWriter<>();
        baWriter.writeModel(os, automaton, automaton.getInputAlphabet());
    }

    static void writeBAFile(String filename, LexerDFA dfa) {
        try (OutputStream os = new FileOutputStream(filename)) {
            writeBA(os, dfa);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
