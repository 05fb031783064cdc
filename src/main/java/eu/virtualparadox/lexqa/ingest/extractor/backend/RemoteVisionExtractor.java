package eu.virtualparadox.lexqa.ingest.extractor.backend;

import eu.virtualparadox.lexqa.application.config.ApplicationConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.ai.content.Media;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.stereotype.Component;
import org.springframework.util.MimeTypeUtils;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;

/**
 * Sends the page image to a multimodal chat model and asks for a verbatim transcription.
 * The chat model is whatever Spring AI provides; without one the backend reports not ready.
 */
@Component
@Slf4j
public class RemoteVisionExtractor implements ExtractorBackend {

    public static final String NAME = "remote-vision";

    private final ObjectProvider<ChatModel> chatModelProvider;
    private final TextQualityScorer qualityScorer;
    private final String prompt;

    public RemoteVisionExtractor(final ObjectProvider<ChatModel> chatModelProvider,
                                 final TextQualityScorer qualityScorer,
                                 final ApplicationConfig config) {
        this.chatModelProvider = chatModelProvider;
        this.qualityScorer = qualityScorer;
        this.prompt = config.getExtraction().getRemoteVisionPrompt();
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public BackendKind kind() {
        return BackendKind.REMOTE_VISION;
    }

    @Override
    public boolean isReady() {
        return chatModelProvider.getIfAvailable() != null;
    }

    @Override
    public ExtractedText extract(final BufferedImage image, final int pageIndex) throws ExtractionException {
        final ChatModel chatModel = chatModelProvider.getIfAvailable();
        if (chatModel == null) {
            throw new ExtractionException(NAME, "No chat model configured");
        }

        final Media page = new Media(MimeTypeUtils.IMAGE_PNG, new ByteArrayResource(toPng(image, pageIndex)));
        final UserMessage message = UserMessage.builder()
                .text(prompt)
                .media(page)
                .build();

        final ChatResponse response;
        try {
            response = chatModel.call(new Prompt(message));
        } catch (RuntimeException e) {
            throw new ExtractionException(NAME, "Remote vision call failed on page " + pageIndex + ": " + e.getMessage(), e);
        }

        if (response == null || response.getResult() == null || response.getResult().getOutput() == null) {
            throw new ExtractionException(NAME, "Empty response for page " + pageIndex);
        }
        final String text = response.getResult().getOutput().getText();
        if (text == null || text.isBlank()) {
            return ExtractedText.empty();
        }
        return new ExtractedText(text.strip(), qualityScorer.score(text));
    }

    private byte[] toPng(final BufferedImage image, final int pageIndex) throws ExtractionException {
        try (ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            if (!ImageIO.write(image, "png", out)) {
                throw new ExtractionException(NAME, "No PNG writer available");
            }
            return out.toByteArray();
        } catch (IOException e) {
            throw new ExtractionException(NAME, "Page " + pageIndex + " could not be encoded", e);
        }
    }
}
