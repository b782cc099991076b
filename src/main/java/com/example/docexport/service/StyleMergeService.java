package com.example.docexport.service;

import com.example.docexport.aspect.LogExecutionTime;
import com.example.docexport.model.ErrorCategory;
import com.example.docexport.model.ExportReport;
import com.example.docexport.model.RenderError;
import com.example.docexport.util.DocxStyles;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.apache.poi.xwpf.usermodel.XWPFRun;
import org.apache.poi.xwpf.usermodel.XWPFStyle;
import org.apache.xmlbeans.XmlObject;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTRPr;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Function;
import java.util.function.IntConsumer;
import java.util.function.Supplier;

/**
 * Copies font settings from a template document onto the paragraph styles of
 * a produced document.
 *
 * For every style name used by the template's body paragraphs, the font of
 * the last run found in a paragraph of that style is the sample. Each body
 * paragraph of the produced document whose style has a sample gets the
 * sample's attributes copied onto its style; an attribute the sample does not
 * set is cleared. Text is never touched.
 */
@Slf4j
@Service
public class StyleMergeService {

    private final Map<String, RunAttribute> attributes = new LinkedHashMap<>();

    public StyleMergeService() {
        register("italic", CTRPr::sizeOfIArray, rPr -> i -> rPr.getIArray(i), rPr -> rPr::addNewI, rPr -> rPr::removeI);
        register("math", CTRPr::sizeOfOMathArray, rPr -> i -> rPr.getOMathArray(i), rPr -> rPr::addNewOMath, rPr -> rPr::removeOMath);
        register("no_proof", CTRPr::sizeOfNoProofArray, rPr -> i -> rPr.getNoProofArray(i), rPr -> rPr::addNewNoProof, rPr -> rPr::removeNoProof);
        register("web_hidden", CTRPr::sizeOfWebHiddenArray, rPr -> i -> rPr.getWebHiddenArray(i), rPr -> rPr::addNewWebHidden, rPr -> rPr::removeWebHidden);
        register("strike", CTRPr::sizeOfStrikeArray, rPr -> i -> rPr.getStrikeArray(i), rPr -> rPr::addNewStrike, rPr -> rPr::removeStrike);
        register("subscript", CTRPr::sizeOfVertAlignArray, rPr -> i -> rPr.getVertAlignArray(i), rPr -> rPr::addNewVertAlign, rPr -> rPr::removeVertAlign);
        register("rtl", CTRPr::sizeOfRtlArray, rPr -> i -> rPr.getRtlArray(i), rPr -> rPr::addNewRtl, rPr -> rPr::removeRtl);
        register("size", CTRPr::sizeOfSzArray, rPr -> i -> rPr.getSzArray(i), rPr -> rPr::addNewSz, rPr -> rPr::removeSz);
        register("color.rgb", CTRPr::sizeOfColorArray, rPr -> i -> rPr.getColorArray(i), rPr -> rPr::addNewColor, rPr -> rPr::removeColor);
        register("shadow", CTRPr::sizeOfShadowArray, rPr -> i -> rPr.getShadowArray(i), rPr -> rPr::addNewShadow, rPr -> rPr::removeShadow);
        register("highlight_color", CTRPr::sizeOfHighlightArray, rPr -> i -> rPr.getHighlightArray(i), rPr -> rPr::addNewHighlight, rPr -> rPr::removeHighlight);
        register("hidden", CTRPr::sizeOfVanishArray, rPr -> i -> rPr.getVanishArray(i), rPr -> rPr::addNewVanish, rPr -> rPr::removeVanish);
        register("cs_bold", CTRPr::sizeOfBCsArray, rPr -> i -> rPr.getBCsArray(i), rPr -> rPr::addNewBCs, rPr -> rPr::removeBCs);
        register("name", CTRPr::sizeOfRFontsArray, rPr -> i -> rPr.getRFontsArray(i), rPr -> rPr::addNewRFonts, rPr -> rPr::removeRFonts);
    }

    @LogExecutionTime("Style Merge")
    public void merge(XWPFDocument produced, XWPFDocument template, ExportReport report) {
        Map<String, XWPFRun> samples = sampleRuns(template);
        log.debug("Template provides samples for styles {}", samples.keySet());
        int merged = 0;
        for (XWPFParagraph paragraph : produced.getParagraphs()) {
            XWPFRun sample = samples.get(DocxStyles.styleName(produced, paragraph));
            XWPFStyle style = paragraph.getStyleID() == null || produced.getStyles() == null
                    ? null
                    : produced.getStyles().getStyle(paragraph.getStyleID());
            if (sample == null || style == null) {
                continue;
            }
            CTRPr source = sample.getCTR().getRPr();
            CTRPr target = DocxStyles.runProperties(style.getCTStyle());
            for (Map.Entry<String, RunAttribute> attribute : attributes.entrySet()) {
                try {
                    attribute.getValue().copy(source, target);
                } catch (RuntimeException e) {
                    log.debug("Skipping attribute {} for style {}: {}", attribute.getKey(), style.getName(), e.getMessage());
                    report.add(RenderError.builder()
                            .category(ErrorCategory.ATTRIBUTE)
                            .message(attribute.getKey() + " on style " + style.getName() + ": " + e.getMessage())
                            .build());
                }
            }
            merged++;
        }
        log.info("Merged template fonts into {} paragraphs", merged);
    }

    /**
     * Style name to the last run seen in a template body paragraph of that style
     */
    Map<String, XWPFRun> sampleRuns(XWPFDocument template) {
        Map<String, XWPFRun> samples = new HashMap<>();
        for (XWPFParagraph paragraph : template.getParagraphs()) {
            String styleName = DocxStyles.styleName(template, paragraph);
            for (XWPFRun run : paragraph.getRuns()) {
                samples.put(styleName, run);
            }
        }
        return samples;
    }

    private void register(String name,
                          Function<CTRPr, Integer> size,
                          Function<CTRPr, Function<Integer, XmlObject>> get,
                          Function<CTRPr, Supplier<XmlObject>> addNew,
                          Function<CTRPr, IntConsumer> remove) {
        attributes.put(name, new RunAttribute(size, get, addNew, remove));
    }

    /**
     * One repeatable rPr child element, accessed through the generated array accessors
     */
    private static class RunAttribute {
        private final Function<CTRPr, Integer> size;
        private final Function<CTRPr, Function<Integer, XmlObject>> get;
        private final Function<CTRPr, Supplier<XmlObject>> addNew;
        private final Function<CTRPr, IntConsumer> remove;

        RunAttribute(Function<CTRPr, Integer> size,
                     Function<CTRPr, Function<Integer, XmlObject>> get,
                     Function<CTRPr, Supplier<XmlObject>> addNew,
                     Function<CTRPr, IntConsumer> remove) {
            this.size = size;
            this.get = get;
            this.addNew = addNew;
            this.remove = remove;
        }

        void copy(CTRPr source, CTRPr target) {
            for (int i = size.apply(target) - 1; i >= 0; i--) {
                remove.apply(target).accept(i);
            }
            if (source != null && size.apply(source) > 0) {
                XmlObject value = get.apply(source).apply(0);
                addNew.apply(target).get().set(value);
            }
        }
    }
}
