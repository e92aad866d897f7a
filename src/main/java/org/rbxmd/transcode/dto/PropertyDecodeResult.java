package org.rbxmd.transcode.dto;

/**
 * {@code rbx_decode_property} 的返回结果。
 *
 * @param name          属性名（只传入值文本时为 null）
 * @param rule          命中的解码规则
 * @param typeName      推断出的 rbxlx 类型标签
 * @param canonicalText 按该类型重新编码后的文本
 */
public record PropertyDecodeResult(
        String name,
        String rule,
        String typeName,
        String canonicalText
) {
}
