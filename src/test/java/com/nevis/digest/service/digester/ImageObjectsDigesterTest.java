package com.nevis.digest.service.digester;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.nevis.digest.model.DigestInput;
import com.nevis.digest.model.FileRecord;
import com.nevis.digest.service.LibraryFileStore;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.ImageContent;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.OffsetDateTime;
import java.util.Base64;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ImageObjectsDigesterTest {

    private static final OffsetDateTime T0 = OffsetDateTime.parse("2025-03-01T12:00:00Z");
    private static final String PATH = "photos/desk.jpg";

    @Mock
    private ChatModel chatModel;

    @Mock
    private LibraryFileStore fileStore;

    private final ObjectMapper objectMapper = new ObjectMapper();

    private ImageObjectsDigester digester;

    private final FileRecord photo = new FileRecord(PATH, "desk.jpg", false, 2048L, "image/jpeg", "h", T0, T0, null);

    @BeforeEach
    void setUp() {
        digester = new ImageObjectsDigester(chatModel, fileStore, objectMapper);
    }

    private static ChatResponse answer(String text) {
        return ChatResponse.builder().aiMessage(AiMessage.from(text)).build();
    }

    @Test
    @DisplayName("Applies to images only")
    void shouldApplyToImages() {
        assertThat(digester.canDigest(photo, List.of())).isTrue();
        assertThat(digester.canDigest(new FileRecord("docs/a.pdf", "a.pdf", false, 1L, "application/pdf", "h",
            T0, T0, null), List.of())).isFalse();
    }

    @Test
    @DisplayName("Sends the image to the vision model and stores every detected object")
    @SuppressWarnings("unchecked")
    void shouldStoreDetectedObjects() throws Exception {
        byte[] jpeg = {1, 2, 3, 4};
        when(fileStore.readBytes(PATH)).thenReturn(jpeg);
        when(chatModel.chat(anyList())).thenReturn(answer("""
            ```json
            {"objects": [
              {"id": "obj_001", "title": "MacBook", "name": "laptop", "category": "electronics",
               "description": "Silver laptop, lid open", "bbox": [0.1, 0.2, 0.6, 0.7], "certainty": "certain"},
              {"id": "obj_002", "title": "Book: Dune", "name": "book", "category": "book",
               "description": "Paperback titled DUNE", "bbox": [0.65, 0.5, 0.9, 0.8], "certainty": "likely"},
              {"id": "obj_003", "title": "", "name": "smudge", "category": "text",
               "description": "", "bbox": [0, 0, 0.1, 0.1], "certainty": "uncertain"}
            ]}
            ```
            """));

        List<DigestInput> result = digester.digest(photo, List.of());

        assertThat(result).singleElement().satisfies(input -> assertThat(input.digester()).isEqualTo(DigestTypes.IMAGE_OBJECTS));
        JsonNode objects = objectMapper.readTree(result.get(0).content()).path("objects");
        assertThat(objects.size()).isEqualTo(2);
        assertThat(objects.get(0).path("title").asText()).isEqualTo("MacBook");
        assertThat(objects.get(1).path("bbox").get(2).asDouble()).isEqualTo(0.9);

        ArgumentCaptor<List<ChatMessage>> messages = ArgumentCaptor.forClass(List.class);
        verify(chatModel).chat(messages.capture());
        assertThat(messages.getValue()).hasSize(2);
        assertThat(messages.getValue().get(0)).isInstanceOf(SystemMessage.class);
        UserMessage user = (UserMessage) messages.getValue().get(1);
        assertThat(user.contents()).filteredOn(ImageContent.class::isInstance)
            .singleElement()
            .satisfies(content -> {
                ImageContent image = (ImageContent) content;
                assertThat(image.image().base64Data()).isEqualTo(Base64.getEncoder().encodeToString(jpeg));
                assertThat(image.image().mimeType()).isEqualTo("image/jpeg");
            });
    }

    @Test
    @DisplayName("An answer without an objects array fails the digest")
    void shouldFailOnMalformedAnswer() {
        when(fileStore.readBytes(PATH)).thenReturn(new byte[]{1});
        when(chatModel.chat(anyList())).thenReturn(answer("I could not see anything useful."));

        assertThatThrownBy(() -> digester.digest(photo, List.of()))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("not JSON");
    }

    @Test
    @DisplayName("An empty scene completes with an empty list")
    void shouldKeepEmptyScene() {
        assertThat(digester.parseObjects("{\"objects\": []}").size()).isZero();
        assertThatThrownBy(() -> digester.parseObjects("{\"items\": []}"))
            .hasMessageContaining("no objects array");
    }
}
