package io.github.barebone.llm.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * One piece of structured message content: either text or an image.
 * Images are referenced by URL, which may be a {@code data:} URL carrying
 * base64 encoded bytes.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class ContentBlock {

    public enum Type {
        TEXT,
        IMAGE
    }

    private final Type type;
    private final String text;
    private final String imageUrl;

    @JsonCreator
    private ContentBlock(
            @JsonProperty("type") Type type,
            @JsonProperty("text") String text,
            @JsonProperty("imageUrl") String imageUrl) {
        this.type = Objects.requireNonNull(type, "type cannot be null");
        this.text = text;
        this.imageUrl = imageUrl;
    }

    public static ContentBlock text(String text) {
        return new ContentBlock(Type.TEXT, text, null);
    }

    public static ContentBlock image(String imageUrl) {
        return new ContentBlock(Type.IMAGE, null, Objects.requireNonNull(imageUrl, "imageUrl cannot be null"));
    }

    public Type getType() {
        return type;
    }

    public String getText() {
        return text;
    }

    public String getImageUrl() {
        return imageUrl;
    }

    public boolean isImage() {
        return type == Type.IMAGE;
    }

    /**
     * Returns true when the image is inline ({@code data:<media type>;base64,<data>}).
     */
    public boolean isDataUrl() {
        return imageUrl != null && imageUrl.startsWith("data:");
    }

    /**
     * Media type of an inline image, e.g. {@code image/png}.
     */
    public String getMediaType() {
        if (!isDataUrl()) {
            return null;
        }
        int semi = imageUrl.indexOf(';');
        return semi > 5 ? imageUrl.substring(5, semi) : null;
    }

    /**
     * Base64 payload of an inline image.
     */
    public String getBase64Data() {
        if (!isDataUrl()) {
            return null;
        }
        int comma = imageUrl.indexOf(',');
        return comma >= 0 ? imageUrl.substring(comma + 1) : null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ContentBlock that = (ContentBlock) o;
        return type == that.type && Objects.equals(text, that.text) && Objects.equals(imageUrl, that.imageUrl);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, text, imageUrl);
    }

    @Override
    public String toString() {
        return type == Type.TEXT ? "ContentBlock{text}" : "ContentBlock{image}";
    }
}
