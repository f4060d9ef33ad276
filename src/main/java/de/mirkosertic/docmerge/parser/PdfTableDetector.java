package de.mirkosertic.docmerge.parser;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.apache.pdfbox.text.TextPosition;

import java.io.IOException;
import java.io.Writer;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Finds column aligned text blocks on a PDF page.
 *
 * <p>Glyphs are grouped into lines by their baseline, lines are split into cells wherever the
 * horizontal gap between two glyphs is wider than a few spaces. Smaller gaps of about a third of a
 * space separate words within a cell. A run of at least two consecutive lines with two or more cells
 * each is a table region. Cells of a region are assigned to columns by their left edge.</p>
 */
class PdfTableDetector extends PDFTextStripper {

    static final float LINE_TOLERANCE = 2.0f;
    static final float MIN_CELL_GAP = 8.0f;
    static final float SPACE_GAP_FACTOR = 3.0f;
    static final float WORD_GAP_FACTOR = 0.3f;
    static final float DEFAULT_SPACE_EM = 0.25f;
    static final float COLUMN_TOLERANCE = 10.0f;

    private final List<TextPosition> positions = new ArrayList<>();

    record Cell(float x, String text) {
    }

    PdfTableDetector() throws IOException {
        super();
        setSortByPosition(true);
    }

    @Override
    protected void writeString(final String text, final List<TextPosition> textPositions) throws IOException {
        positions.addAll(textPositions);
    }

    /**
     * Detect table regions on one page.
     *
     * @param pageNumber 1-based page number
     * @return raw rectangular rows per region, first row is the header row
     */
    List<List<List<String>>> detect(final PDDocument document, final int pageNumber) throws IOException {
        positions.clear();
        setStartPage(pageNumber);
        setEndPage(pageNumber);
        writeText(document, Writer.nullWriter());

        final List<List<Cell>> lines = new ArrayList<>();
        for (final List<TextPosition> line : groupLines(positions)) {
            final List<Cell> cells = splitCells(line);
            if (!cells.isEmpty()) {
                lines.add(cells);
            }
        }

        final List<List<List<String>>> regions = new ArrayList<>();
        int start = 0;
        while (start < lines.size()) {
            if (lines.get(start).size() < 2) {
                start++;
                continue;
            }
            int end = start;
            while (end < lines.size() && lines.get(end).size() >= 2) {
                end++;
            }
            if (end - start >= 2) {
                regions.add(alignColumns(lines.subList(start, end)));
            }
            start = end;
        }
        return regions;
    }

    static List<List<TextPosition>> groupLines(final List<TextPosition> glyphs) {
        final List<TextPosition> sorted = new ArrayList<>(glyphs);
        sorted.sort(Comparator.comparingDouble(TextPosition::getYDirAdj).thenComparingDouble(TextPosition::getXDirAdj));

        final List<List<TextPosition>> lines = new ArrayList<>();
        List<TextPosition> current = new ArrayList<>();
        float lineY = Float.NaN;
        for (final TextPosition glyph : sorted) {
            if (!Float.isNaN(lineY) && Math.abs(glyph.getYDirAdj() - lineY) > LINE_TOLERANCE) {
                lines.add(current);
                current = new ArrayList<>();
            }
            if (current.isEmpty()) {
                lineY = glyph.getYDirAdj();
            }
            current.add(glyph);
        }
        if (!current.isEmpty()) {
            lines.add(current);
        }
        for (final List<TextPosition> line : lines) {
            line.sort(Comparator.comparingDouble(TextPosition::getXDirAdj));
        }
        return lines;
    }

    static List<Cell> splitCells(final List<TextPosition> line) {
        final List<Cell> cells = new ArrayList<>();
        StringBuilder text = new StringBuilder();
        float cellX = 0;
        float previousEnd = Float.NaN;
        boolean pendingSpace = false;

        for (final TextPosition glyph : line) {
            final String unicode = glyph.getUnicode();
            if (unicode == null || unicode.isBlank()) {
                pendingSpace = true;
                continue;
            }
            final float x = glyph.getXDirAdj();
            final float spaceWidth = spaceWidth(glyph);
            final float gapLimit = Math.max(SPACE_GAP_FACTOR * spaceWidth, MIN_CELL_GAP);
            final float gap = x - previousEnd;
            if (Float.isNaN(previousEnd) || gap > gapLimit) {
                if (text.length() > 0) {
                    cells.add(new Cell(cellX, text.toString()));
                }
                text = new StringBuilder();
                cellX = x;
            } else if (pendingSpace || gap > WORD_GAP_FACTOR * spaceWidth) {
                // Word breaks are often drawn as a shifted position rather than a blank glyph
                text.append(' ');
            }
            text.append(unicode);
            previousEnd = x + glyph.getWidthDirAdj();
            pendingSpace = false;
        }
        if (text.length() > 0) {
            cells.add(new Cell(cellX, text.toString()));
        }
        return cells;
    }

    private static float spaceWidth(final TextPosition glyph) {
        final float width = glyph.getWidthOfSpace();
        if (Float.isNaN(width) || width <= 0) {
            return glyph.getFontSizeInPt() * DEFAULT_SPACE_EM;
        }
        return width;
    }

    static List<List<String>> alignColumns(final List<List<Cell>> lines) {
        final List<Float> starts = new ArrayList<>();
        for (final List<Cell> line : lines) {
            for (final Cell cell : line) {
                starts.add(cell.x());
            }
        }
        starts.sort(Float::compare);

        final List<Float> anchors = new ArrayList<>();
        for (final Float x : starts) {
            if (anchors.isEmpty() || x - anchors.get(anchors.size() - 1) > COLUMN_TOLERANCE) {
                anchors.add(x);
            }
        }

        final List<List<String>> rows = new ArrayList<>(lines.size());
        for (final List<Cell> line : lines) {
            final String[] row = new String[anchors.size()];
            for (final Cell cell : line) {
                int column = 0;
                for (int i = 0; i < anchors.size(); i++) {
                    if (anchors.get(i) <= cell.x() + COLUMN_TOLERANCE) {
                        column = i;
                    }
                }
                row[column] = row[column] == null ? cell.text() : row[column] + " " + cell.text();
            }
            final List<String> values = new ArrayList<>(row.length);
            for (final String value : row) {
                values.add(value == null ? "" : value);
            }
            rows.add(values);
        }
        return rows;
    }
}
