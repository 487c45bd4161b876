package io.github.lodestone.orm.api.exceptions.json;

/**
 * Position inside a JSON document where decoding failed. Unknown coordinates are {@code -1}.
 */
public record JsonLocation(int lineNumber, int columnNumber, long charOffset) {
    public static final JsonLocation UNKNOWN = new JsonLocation(-1, -1, -1);

    @Override
    public String toString() {
        return "line " + lineNumber + ", column " + columnNumber;
    }
}
