package org.calista.qualia;

import org.calista.qualia.diagnostics.Diagnostics;
import org.calista.qualia.framebook.Framebook;
import org.calista.qualia.framebook.FramebookLoader;
import org.calista.qualia.io.FileIO;
import org.calista.qualia.language.RegexSentenceSegmenter;
import org.calista.qualia.model.Document;
import org.calista.qualia.model.Turn;

/**
 * Shared test data: the small English framebook and respondent-only documents.
 */
public final class Fixtures {

    public static final String FRAMEBOOK = "framebook-test.json";

    private Fixtures() {}

    public static Framebook framebook() {
        return framebook(new Diagnostics());
    }

    public static Framebook framebook(Diagnostics diagnostics) {
        return new FramebookLoader(new FileIO(), diagnostics).loadResource(FRAMEBOOK);
    }

    /** One respondent turn per text, ids from 1, sentences split by the regex segmenter. */
    public static Document respondentDocument(String id, String... texts) {
        Document.Builder b = Document.builder(id).language("en");
        for (int i = 0; i < texts.length; i++) {
            b.turn(turn(i + 1, Turn.RESPONDENT, texts[i]));
        }
        return b.build();
    }

    public static Turn turn(int id, String role, String text) {
        return new Turn(id, role, role, text, RegexSentenceSegmenter.INSTANCE.split(text));
    }
}
