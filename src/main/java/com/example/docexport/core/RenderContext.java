package com.example.docexport.core;

import com.example.docexport.config.RenderProperties;
import com.example.docexport.model.Block;
import com.example.docexport.model.Entity;
import com.example.docexport.model.ErrorCategory;
import com.example.docexport.model.ExportReport;
import com.example.docexport.model.RenderError;
import com.example.docexport.text.RunDefaults;
import lombok.Getter;
import org.apache.poi.xwpf.usermodel.XWPFDocument;

import java.math.BigInteger;
import java.util.List;
import java.util.Map;

/**
 * Structural state of one article render. Created when the article starts and
 * dropped when it ends, so tables, dictionaries, header-step numbering and
 * ordered-list numbering never leak into the next article.
 */
@Getter
public class RenderContext {

    private static final int BASE_DEPTH = 1;

    /**
     * The only format version whose cells declare their table's column count
     */
    public static final int DECLARED_TABLE_VERSION = 3;

    private final DocumentCursor cursor;
    private final List<Block> blocks;
    private final Map<String, Entity> entityMap;
    private final int docVersion;
    private final ExportReport report;

    private int position = -1;
    private int currentDepth = BASE_DEPTH;
    private int headerStepCounter;
    private TableCursor table;
    private DictionaryCursor dictionary;
    private BigInteger orderedListNumId;

    public RenderContext(DocumentCursor cursor, List<Block> blocks, Map<String, Entity> entityMap,
                         int docVersion, ExportReport report) {
        this.cursor = cursor;
        this.blocks = blocks;
        this.entityMap = entityMap == null ? Map.of() : entityMap;
        this.docVersion = docVersion;
        this.report = report;
    }

    public boolean declaresTableColumns() {
        return docVersion == DECLARED_TABLE_VERSION;
    }

    public XWPFDocument getDocument() {
        return cursor.getDocument();
    }

    public RenderProperties getProperties() {
        return cursor.getProperties();
    }

    public RunDefaults runDefaults() {
        return cursor.getProperties().runDefaults();
    }

    /**
     * Marks the block at {@code index} as the one being dispatched
     */
    public void moveTo(int index) {
        this.position = index;
    }

    /**
     * Block dispatched right before the current one, or null at the start
     */
    public Block previousBlock() {
        return position > 0 && position <= blocks.size() ? blocks.get(position - 1) : null;
    }

    public void enterDepth(int depth) {
        currentDepth += depth;
    }

    public void exitDepth(int depth) {
        currentDepth -= depth;
    }

    public int nextHeaderStep() {
        return ++headerStepCounter;
    }

    public boolean hasOpenTable() {
        return table != null;
    }

    public TableCursor openTable(TableCursor tableCursor) {
        this.table = tableCursor;
        return tableCursor;
    }

    public void closeTable() {
        this.table = null;
    }

    public boolean hasOpenDictionary() {
        return dictionary != null;
    }

    public DictionaryCursor openDictionary(DictionaryCursor dictionaryCursor) {
        this.dictionary = dictionaryCursor;
        return dictionaryCursor;
    }

    public void closeDictionary() {
        this.dictionary = null;
    }

    public void startOrderedList() {
        this.orderedListNumId = cursor.getNumbering().newOrderedList();
    }

    public BigInteger orderedListNumId() {
        if (orderedListNumId == null) {
            startOrderedList();
        }
        return orderedListNumId;
    }

    public void recordError(Block block, ErrorCategory category, String message) {
        report.add(RenderError.builder()
                .blockKey(block == null ? null : block.getKey())
                .blockType(block == null ? null : block.getType())
                .category(category)
                .message(message)
                .build());
    }
}
