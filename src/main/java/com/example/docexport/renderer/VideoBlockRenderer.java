package com.example.docexport.renderer;

import com.example.docexport.client.VideoThumbnailResolver;
import com.example.docexport.core.RenderContext;
import com.example.docexport.exception.ExternalServiceException;
import com.example.docexport.exception.ImageFormatException;
import com.example.docexport.model.Block;
import com.example.docexport.model.BlockType;
import com.example.docexport.model.ErrorCategory;
import com.example.docexport.service.PictureInserter;
import com.example.docexport.util.DocxStyles;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.xwpf.usermodel.ParagraphAlignment;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Embedded videos: a framed thumbnail when the provider is recognised,
 * followed by a caption with the label and the video URL.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class VideoBlockRenderer implements BlockRenderer {

    private final VideoThumbnailResolver thumbnailResolver;
    private final PictureInserter pictureInserter;
    private final RunWriter runWriter;

    @Override
    public boolean supports(BlockType type) {
        return type == BlockType.VIDEO;
    }

    @Override
    public void render(Block block, RenderContext context) {
        String src = block.dataString("src");
        if (src == null || src.isBlank()) {
            log.debug("Video block {} has no source", block.getKey());
            return;
        }
        XWPFParagraph picture = context.getCursor().newParagraph();
        picture.setAlignment(ParagraphAlignment.CENTER);
        try {
            Optional<String> thumbnail = thumbnailResolver.thumbnailUrl(src);
            if (thumbnail.isPresent()) {
                pictureInserter.insertPicture(picture.createRun(), thumbnail.get(), true);
            }
        } catch (ExternalServiceException e) {
            log.warn("No thumbnail for video {}: {}", src, e.getMessage());
            context.recordError(block, ErrorCategory.EXTERNAL_SERVICE, e.getMessage());
        } catch (ImageFormatException e) {
            log.warn("Unreadable thumbnail for video {}: {}", src, e.getMessage());
            context.recordError(block, ErrorCategory.IMAGE_FORMAT, e.getMessage());
        }

        XWPFParagraph caption = context.getCursor().newParagraph(DocxStyles.CAPTION);
        caption.setAlignment(ParagraphAlignment.CENTER);
        String label = block.dataString("label");
        runWriter.plainRun(caption, label == null ? "" : label, context).setBold(true);
        caption.createRun().addBreak();
        runWriter.plainRun(caption, src, context).setBold(true);
    }
}
