package com.timxs.watermarktoolkit.config;

/**
 * 输出文件命名规则
 *
 * @param prefix           文件名前缀，为空表示不加前缀
 * @param keepOriginalName 是否保留原文件名，为 false 时使用三位序号
 */
public record NamingOptions(String prefix, boolean keepOriginalName) {

    public static final NamingOptions ORIGINAL = new NamingOptions("", true);

    public NamingOptions {
        prefix = prefix == null ? "" : prefix.trim();
    }

    /**
     * 前缀中不允许出现的字符（路径分隔符和 Windows 保留字符）
     */
    private static final String FORBIDDEN_CHARS = "/\\<>:\"|?*";

    public static NamingOptions from(OutputSettings output) {
        return new NamingOptions(output.getNamePrefix(), output.isKeepOriginalName());
    }

    /**
     * 检查前缀能否作为文件名的一部分
     *
     * @return 不合法的原因，合法时返回 null
     */
    public String prefixProblem() {
        if (prefix.contains("..")) {
            return "文件名前缀不能包含 ..";
        }
        for (int i = 0; i < prefix.length(); i++) {
            char c = prefix.charAt(i);
            if (c < 0x20 || FORBIDDEN_CHARS.indexOf(c) >= 0) {
                return "文件名前缀包含非法字符: " + (c < 0x20 ? String.format("\\u%04x", (int) c) : String.valueOf(c));
            }
        }
        return null;
    }

    /**
     * 生成不带扩展名的文件名
     *
     * @param baseName 原文件名（不含扩展名）
     * @param index    文件序号（从 1 开始）
     * @return 文件名主体
     */
    public String stem(String baseName, int index) {
        if (keepOriginalName) {
            return prefix.isEmpty() ? baseName : prefix + "_" + baseName;
        }
        String number = String.format("%03d", index);
        return prefix.isEmpty() ? number : prefix + "_" + number;
    }
}
