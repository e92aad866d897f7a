package org.rbxmd.transcode;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.unit.DataSize;
import org.springframework.validation.annotation.Validated;

import java.util.List;

/**
 * rbxlx ⇄ Markdown 转换服务的业务配置（{@code app.md.*}）。
 * <p>
 * 重点：
 * <ul>
 *   <li>通过 {@link #roots} 指定允许读写的工作目录白名单。</li>
 *   <li>{@code show-class/show-properties/single-file} 是 Markdown 输出的默认选项，工具参数可以覆盖。</li>
 *   <li>{@link #readMaxBytes} 限制单个输入文件的大小，避免把超大场景一次性读入内存。</li>
 * </ul>
 */
@Validated
@ConfigurationProperties(prefix = "app.md")
public class TranscodeProperties {

    /**
     * 允许访问的工作目录白名单（rootId 依次为 root0、root1...）。
     */
    @NotNull
    private List<String> roots = List.of(".");

    /**
     * 默认的过滤设置文件（相对于输入文件所在目录解析；不存在时使用默认设置）。
     */
    @NotBlank
    private String settingsFile = "rbxlx-to-md-settings.json";

    /**
     * 记录头是否输出 {@code [Class]}。
     */
    private boolean showClass = false;

    /**
     * 是否输出属性行。
     */
    private boolean showProperties = true;

    /**
     * 是否输出到单个文件（否则按路径首段拆分为多个 .md 文件）。
     */
    private boolean singleFile = false;

    /**
     * 路径过滤模式中可省略的根前缀。
     */
    @NotNull
    private String rootPrefix = "game";

    /**
     * Markdown 记录头缺少 {@code [Class]} 时使用的类名。
     */
    @NotBlank
    private String defaultClass = "Part";

    /**
     * 重建树时为缺失的中间路径创建的占位节点类名。
     */
    @NotBlank
    private String placeholderClass = "Folder";

    /**
     * 单个输入文件的最大字节数。
     */
    @NotNull
    private DataSize readMaxBytes = DataSize.ofMegabytes(256);

    /**
     * 是否允许写出转换结果。
     */
    private boolean allowWrite = true;

    /**
     * 是否允许访问符号链接（默认不允许，防止路径逃逸）。
     */
    private boolean allowSymlink = false;

    public List<String> getRoots() {
        return roots;
    }

    public void setRoots(List<String> roots) {
        this.roots = roots;
    }

    public String getSettingsFile() {
        return settingsFile;
    }

    public void setSettingsFile(String settingsFile) {
        this.settingsFile = settingsFile;
    }

    public boolean isShowClass() {
        return showClass;
    }

    public void setShowClass(boolean showClass) {
        this.showClass = showClass;
    }

    public boolean isShowProperties() {
        return showProperties;
    }

    public void setShowProperties(boolean showProperties) {
        this.showProperties = showProperties;
    }

    public boolean isSingleFile() {
        return singleFile;
    }

    public void setSingleFile(boolean singleFile) {
        this.singleFile = singleFile;
    }

    public String getRootPrefix() {
        return rootPrefix;
    }

    public void setRootPrefix(String rootPrefix) {
        this.rootPrefix = rootPrefix;
    }

    public String getDefaultClass() {
        return defaultClass;
    }

    public void setDefaultClass(String defaultClass) {
        this.defaultClass = defaultClass;
    }

    public String getPlaceholderClass() {
        return placeholderClass;
    }

    public void setPlaceholderClass(String placeholderClass) {
        this.placeholderClass = placeholderClass;
    }

    public DataSize getReadMaxBytes() {
        return readMaxBytes;
    }

    public void setReadMaxBytes(DataSize readMaxBytes) {
        this.readMaxBytes = readMaxBytes;
    }

    public boolean isAllowWrite() {
        return allowWrite;
    }

    public void setAllowWrite(boolean allowWrite) {
        this.allowWrite = allowWrite;
    }

    public boolean isAllowSymlink() {
        return allowSymlink;
    }

    public void setAllowSymlink(boolean allowSymlink) {
        this.allowSymlink = allowSymlink;
    }
}
