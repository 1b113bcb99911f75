package org.dxworks.pycscope.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One source line as a sequence of symbol and non-symbol runs.
 *
 * Once a symbol is present, the rendered form alternates between symbol and
 * non-symbol lines; cscope relies on that when it reassembles the source text.
 */
public class Line {
    private final int number;
    private final List<TextRun> runs = new ArrayList<>();
    private boolean hasSymbol;

    public Line(int number) {
        if (number <= 0) {
            throw new IllegalArgumentException("Line numbers are 1-based, got " + number);
        }
        this.number = number;
    }

    public int getNumber() {
        return number;
    }

    public List<TextRun> getRuns() {
        return Collections.unmodifiableList(runs);
    }

    public boolean hasSymbol() {
        return hasSymbol;
    }

    public Line append(TextRun run) {
        TextRun last = runs.isEmpty() ? null : runs.get(runs.size() - 1);

        if (run instanceof Symbol && ((Symbol) run).hasMark(Mark.FUNC_END)) {
            // A function end is never merged; keep it apart from a preceding symbol
            if (last instanceof Symbol) {
                runs.add(NonSymbol.separator());
            }
            runs.add(run);
            hasSymbol = true;
            return this;
        }

        if (last instanceof Symbol && run instanceof Symbol
                && ((Symbol) last).getMark() == ((Symbol) run).getMark()) {
            ((Symbol) last).merge((Symbol) run);
        } else if (last instanceof NonSymbol && run instanceof NonSymbol) {
            ((NonSymbol) last).merge((NonSymbol) run);
        } else {
            if (run instanceof Symbol) {
                hasSymbol = true;
            }
            runs.add(run);
        }
        return this;
    }

    /**
     * Renders the line in database form, or returns the empty string when the
     * line carries no symbol at all.
     */
    public String render() {
        if (!hasSymbol) {
            return "";
        }

        List<String> out = new ArrayList<>();
        TextRun first = runs.get(0);
        if (first instanceof Symbol) {
            // the line number sits alone, with a trailing blank, before a symbol
            out.add(number + " ");
            out.add(first.format());
        } else {
            out.add(number + " " + first.format());
        }

        for (int i = 1; i < runs.size(); i++) {
            TextRun run = runs.get(i);
            String text = run.format();
            if (run instanceof Symbol) {
                int lastIndex = out.size() - 1;
                if (!NonSymbol.SEPARATOR.equals(out.get(lastIndex))) {
                    out.set(lastIndex, out.get(lastIndex) + " ");
                }
            } else if (!NonSymbol.SEPARATOR.equals(text)) {
                text = " " + text;
            }
            out.add(text);
        }

        return String.join("\n", out) + "\n\n";
    }

    @Override
    public String toString() {
        return "<Line:" + render().replace("\n", "\\n") + ">";
    }
}
