package com.graphqldemo.graphql.pagination;

import com.graphqldemo.auth.exception.ErrorCode;
import com.graphqldemo.auth.exception.ValidationException;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

/**
 * 游标编解码。游标对客户端不透明，内部为 "cursor:{offset}" 的 Base64。
 */
public final class CursorCodec {

    private static final String PREFIX = "cursor:";

    private CursorCodec() {
    }

    public static String encode(int offset) {
        return Base64.getUrlEncoder().withoutPadding()
                .encodeToString((PREFIX + offset).getBytes(StandardCharsets.UTF_8));
    }

    /**
     * @throws ValidationException 游标格式非法时抛出（字段 after）。
     */
    public static int decode(String cursor) {
        try {
            String raw = new String(Base64.getUrlDecoder().decode(cursor), StandardCharsets.UTF_8);
            if (!raw.startsWith(PREFIX)) {
                throw invalid();
            }
            int offset = Integer.parseInt(raw.substring(PREFIX.length()));
            // 下一页从 offset + 1 开始，不能越过 int 上限
            if (offset < 0 || offset == Integer.MAX_VALUE) {
                throw invalid();
            }
            return offset;
        } catch (IllegalArgumentException ex) {
            throw invalid();
        }
    }

    private static ValidationException invalid() {
        return ValidationException.ofField(ErrorCode.VALIDATION_FAILED, "after", "Invalid cursor.");
    }
}
