package org.rbxmd.mcp;

import org.rbxmd.transcode.TranscodeProperties;
import org.rbxmd.transcode.WorkspacePathResolver;
import org.rbxmd.transcode.codec.PathCodec;
import org.rbxmd.transcode.codec.PropertyCodec;
import org.rbxmd.transcode.dto.MarkdownExportResult;
import org.rbxmd.transcode.dto.MarkdownFileEntry;
import org.rbxmd.transcode.dto.PathSplitResult;
import org.rbxmd.transcode.dto.PropertyDecodeResult;
import org.rbxmd.transcode.dto.RbxlxImportResult;
import org.rbxmd.transcode.filter.FilterConfig;
import org.rbxmd.transcode.filter.FilterSettingsLoader;
import org.rbxmd.transcode.markdown.MarkdownRecordParser;
import org.rbxmd.transcode.markdown.MarkdownRecordWriter;
import org.rbxmd.transcode.model.NodeRecord;
import org.rbxmd.transcode.model.Property;
import org.rbxmd.transcode.model.PropertyValue.Unsupported;
import org.rbxmd.transcode.model.SceneNode;
import org.rbxmd.transcode.tree.TreeBuilder;
import org.rbxmd.transcode.tree.TreeWalker;
import org.rbxmd.transcode.xml.RbxlxReader;
import org.rbxmd.transcode.xml.RbxlxWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.ai.tool.annotation.ToolParam;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * rbxlx ⇄ Markdown 转换的 MCP 工具集合。
 * <p>
 * 提供能力：
 * <ul>
 *   <li>rbxlx 场景文件转换为按路径扁平化的 Markdown（{@code rbx_convert_to_markdown}）。</li>
 *   <li>Markdown（单个文件或目录）重建为 rbxlx（{@code rbx_convert_to_rbxlx}）。</li>
 *   <li>单条属性行的类型推断（{@code rbx_decode_property}）与路径拆分（{@code rbx_split_path}），便于排查往返差异。</li>
 * </ul>
 * <p>
 * 安全策略：所有路径都经过 {@link WorkspacePathResolver}，只允许访问 {@code app.md.roots} 白名单目录；
 * {@code app.md.allow-write=false} 时拒绝写出。
 */
@Component
public class RbxlxMcpTools {

    private static final Logger log = LoggerFactory.getLogger(RbxlxMcpTools.class);

    private static final String RBXLX_EXTENSION = ".rbxlx";

    private final TranscodeProperties properties;
    private final WorkspacePathResolver pathResolver;

    public RbxlxMcpTools(TranscodeProperties properties, WorkspacePathResolver pathResolver) {
        this.properties = properties;
        this.pathResolver = pathResolver;
    }

    @Tool(
            name = "rbx_convert_to_markdown",
            description = "把 rbxlx 场景文件转换为 Markdown 路径文本（每个节点一段：path (id) [class] + 属性行），默认按顶层路径拆分为多个 .md 文件。"
    )
    public MarkdownExportResult convertToMarkdown(
            @ToolParam(required = false, description = "rootId（为空默认 root0）") String rootId,
            @ToolParam(description = "输入 rbxlx 文件路径（相对 rootId 或绝对路径）") String path,
            @ToolParam(required = false, description = "输出路径：多文件模式为目录，单文件模式为 .md 文件；为空时与输入文件同名") String outputPath,
            @ToolParam(required = false, description = "过滤设置 JSON 路径；为空时查找输入文件同目录下的 app.md.settings-file") String settingsPath,
            @ToolParam(required = false, description = "记录头是否输出 [Class]（默认 app.md.show-class）") Boolean showClass,
            @ToolParam(required = false, description = "是否输出属性行（默认 app.md.show-properties）") Boolean showProperties,
            @ToolParam(required = false, description = "是否输出到单个文件（默认 app.md.single-file）") Boolean singleFile
    ) {
        ensureWritable();
        WorkspacePathResolver.ResolvedPath input = pathResolver.resolve(rootId, path, true);
        Path inputFile = input.absolutePath();
        if (!Files.isRegularFile(inputFile, LinkOption.NOFOLLOW_LINKS)) {
            throw new IllegalArgumentException("输入不是文件：" + input.displayPath());
        }
        String xml = readText(inputFile);

        List<String> warnings = new ArrayList<>();
        String usedSettings = null;
        FilterConfig cfg = FilterConfig.defaults().withRootPrefix(properties.getRootPrefix());
        Path settingsFile = resolveSettings(input, settingsPath);
        if (settingsFile != null) {
            FilterSettingsLoader.Loaded loaded = FilterSettingsLoader.load(settingsFile, properties.getRootPrefix());
            cfg = loaded.config();
            if (loaded.warnings() != null) {
                warnings.addAll(loaded.warnings());
            }
            if (Files.isRegularFile(settingsFile, LinkOption.NOFOLLOW_LINKS)) {
                usedSettings = displayPath(input, settingsFile);
            }
        }

        List<SceneNode> nodes = RbxlxReader.read(xml);
        TreeWalker.WalkResult walk = TreeWalker.walk(nodes, cfg);
        if (walk.warnings() != null) {
            warnings.addAll(walk.warnings());
        }

        boolean single = singleFile != null ? singleFile : properties.isSingleFile();
        boolean withClass = showClass != null ? showClass : properties.isShowClass();
        boolean withProperties = showProperties != null ? showProperties : properties.isShowProperties();

        Path target = resolveOutput(input, outputPath,
                baseName(inputFile.getFileName().toString()) + (single ? MarkdownRecordWriter.FILE_EXTENSION : ""));

        List<MarkdownFileEntry> files = new ArrayList<>();
        long outputLines = 0;
        try {
            if (single) {
                String text = MarkdownRecordWriter.render(walk.records(), withClass, withProperties);
                writeAtomically(target, text.getBytes(StandardCharsets.UTF_8));
                long lines = MarkdownRecordWriter.countLines(text);
                outputLines += lines;
                files.add(new MarkdownFileEntry(null, displayPath(input, target), walk.records().size(), lines));
            } else {
                Files.createDirectories(target);
                Set<String> usedNames = new HashSet<>();
                for (Map.Entry<String, List<NodeRecord>> group : MarkdownRecordWriter.group(walk.records()).entrySet()) {
                    String fileName = uniqueFileName(MarkdownRecordWriter.fileNameFor(group.getKey()), usedNames);
                    if (!fileName.equals(MarkdownRecordWriter.fileNameFor(group.getKey()))) {
                        warnings.add("分组 '" + group.getKey() + "' 的文件名与其他分组冲突，已改为 " + fileName);
                    }
                    Path file = target.resolve(fileName);
                    String text = MarkdownRecordWriter.render(group.getValue(), withClass, withProperties);
                    writeAtomically(file, text.getBytes(StandardCharsets.UTF_8));
                    long lines = MarkdownRecordWriter.countLines(text);
                    outputLines += lines;
                    files.add(new MarkdownFileEntry(group.getKey(), displayPath(input, file), group.getValue().size(), lines));
                }
            }
        } catch (IOException e) {
            throw new IllegalStateException("写入 Markdown 失败：" + target, e);
        }

        MarkdownRecordWriter.LineStats stats =
                MarkdownRecordWriter.lineStats(MarkdownRecordWriter.countLines(xml), outputLines);
        log.info("rbxlx -> md: {} 条记录写入 {} 个文件，{} 行 -> {} 行（减少 {}%）",
                walk.records().size(), files.size(), stats.inputLines(), stats.outputLines(),
                String.format(Locale.ROOT, "%.2f", stats.reductionPercent()));

        return new MarkdownExportResult(
                input.rootId(),
                normalizeDisplayPath(input.displayPath()),
                usedSettings,
                walk.records().size(),
                files,
                stats.inputLines(),
                stats.outputLines(),
                stats.reducedLines(),
                Math.round(stats.reductionPercent() * 100.0) / 100.0,
                warnings.isEmpty() ? null : warnings
        );
    }

    @Tool(
            name = "rbx_convert_to_rbxlx",
            description = "把 Markdown 路径文本（单个 .md 文件或包含 .md 的目录）重建为 rbxlx 场景文件；缺失的中间路径会生成 Folder 占位节点。"
    )
    public RbxlxImportResult convertToRbxlx(
            @ToolParam(required = false, description = "rootId（为空默认 root0）") String rootId,
            @ToolParam(description = "输入 .md 文件或目录（目录会递归查找 .md）") String path,
            @ToolParam(required = false, description = "输出 rbxlx 路径；为空时与输入同名（扩展名改为 .rbxlx）") String outputPath,
            @ToolParam(required = false, description = "记录头缺少 [Class] 时使用的类名（默认 app.md.default-class）") String defaultClass
    ) {
        ensureWritable();
        WorkspacePathResolver.ResolvedPath input = pathResolver.resolve(rootId, path, true);
        Path source = input.absolutePath();

        List<Path> mdFiles = collectMarkdownFiles(source);
        if (mdFiles.isEmpty()) {
            throw new IllegalArgumentException("未找到 Markdown 文件：" + input.displayPath());
        }

        String classFallback = defaultClass == null || defaultClass.isBlank() ? properties.getDefaultClass() : defaultClass;
        List<String> warnings = new ArrayList<>();
        TreeBuilder builder = new TreeBuilder(properties.getPlaceholderClass(), null);
        List<String> sourceFiles = new ArrayList<>(mdFiles.size());
        int recordCount = 0;
        for (Path file : mdFiles) {
            List<NodeRecord> records = MarkdownRecordParser.parse(readText(file), classFallback, warnings);
            records.forEach(builder::insert);
            recordCount += records.size();
            sourceFiles.add(displayPath(input, file));
        }
        TreeBuilder.BuildResult built = builder.result();
        if (built.warnings() != null) {
            warnings.addAll(built.warnings());
        }

        String xml = RbxlxWriter.write(built.roots(), warnings);
        byte[] bytes = xml.getBytes(StandardCharsets.UTF_8);

        String defaultName = Files.isDirectory(source, LinkOption.NOFOLLOW_LINKS)
                ? source.getFileName() + RBXLX_EXTENSION
                : baseName(source.getFileName().toString()) + RBXLX_EXTENSION;
        Path target = resolveOutput(input, outputPath, defaultName);
        try {
            writeAtomically(target, bytes);
        } catch (IOException e) {
            throw new IllegalStateException("写入 rbxlx 失败：" + target, e);
        }

        int items = countNodes(built.roots());
        log.info("md -> rbxlx: {} 个文件、{} 条记录 -> {} 个 Item（占位 {} 个）",
                mdFiles.size(), recordCount, items, built.placeholderCount());

        return new RbxlxImportResult(
                input.rootId(),
                displayPath(input, target),
                sourceFiles,
                recordCount,
                items,
                built.placeholderCount(),
                bytes.length,
                warnings.isEmpty() ? null : warnings
        );
    }

    @Tool(
            name = "rbx_decode_property",
            description = "推断单条 Markdown 属性行（- Name: value）或单个值文本的类型，返回命中的解码规则与规范化文本。"
    )
    public PropertyDecodeResult decodeProperty(
            @ToolParam(description = "属性行（- Name: value）或值文本") String line
    ) {
        if (line == null) {
            throw new IllegalArgumentException("line 不能为空");
        }
        String trimmed = line.strip();
        if (trimmed.startsWith("- ")) {
            Property property = PropertyCodec.decodeLine(trimmed);
            if (property == null) {
                throw new IllegalArgumentException("无法解析属性行：" + line);
            }
            // 子元素展开的未知类型：只有头部，没有值文本
            if (property.value() instanceof Unsupported header && header.text() == null) {
                return new PropertyDecodeResult(property.name(), "Unsupported", header.typeName(),
                        PropertyCodec.encodeBlock(property, null));
            }
            String body = trimmed.substring(2);
            int colon = body.indexOf(':');
            PropertyCodec.Decoded decoded = PropertyCodec.decodeDetailed(body.substring(colon + 1));
            return new PropertyDecodeResult(property.name(), decoded.rule(),
                    decoded.value().typeName(), PropertyCodec.encodeValue(decoded.value()));
        }
        PropertyCodec.Decoded decoded = PropertyCodec.decodeDetailed(trimmed);
        return new PropertyDecodeResult(null, decoded.rule(), decoded.value().typeName(),
                PropertyCodec.encodeValue(decoded.value()));
    }

    @Tool(
            name = "rbx_split_path",
            description = "拆分 Markdown 记录路径（支持 [\"带空格的名称\"] 引号段），返回原始名称列表与规范化路径。"
    )
    public PathSplitResult splitPath(
            @ToolParam(description = "记录路径，例如 Workspace[\"Spawn Point\"].Decal") String path
    ) {
        if (path == null) {
            throw new IllegalArgumentException("path 不能为空");
        }
        List<String> segments = PathCodec.split(path.strip());
        String leaf = segments.isEmpty() ? "" : segments.get(segments.size() - 1);
        return new PathSplitResult(path, segments, leaf, PathCodec.fromSegments(segments));
    }

    private void ensureWritable() {
        if (!properties.isAllowWrite()) {
            throw new IllegalStateException("写入已禁用（app.md.allow-write=false）");
        }
    }

    private Path resolveSettings(WorkspacePathResolver.ResolvedPath input, String settingsPath) {
        if (settingsPath != null && !settingsPath.isBlank()) {
            return pathResolver.resolve(input.rootId(), settingsPath, false).absolutePath();
        }
        Path candidate = input.absolutePath().resolveSibling(properties.getSettingsFile());
        // 默认设置文件不存在时静默使用默认配置
        if (!Files.isRegularFile(candidate, LinkOption.NOFOLLOW_LINKS)) {
            return null;
        }
        return pathResolver.resolve(input.rootId(), candidate.toString(), true).absolutePath();
    }

    private Path resolveOutput(WorkspacePathResolver.ResolvedPath input, String outputPath, String defaultName) {
        if (outputPath != null && !outputPath.isBlank()) {
            return pathResolver.resolveForWrite(input.rootId(), outputPath).absolutePath();
        }
        Path sibling = input.absolutePath().resolveSibling(defaultName);
        return pathResolver.resolveForWrite(input.rootId(), sibling.toString()).absolutePath();
    }

    private List<Path> collectMarkdownFiles(Path source) {
        if (Files.isRegularFile(source, LinkOption.NOFOLLOW_LINKS)) {
            return List.of(source);
        }
        try (Stream<Path> stream = Files.walk(source)) {
            return stream
                    .filter(p -> Files.isRegularFile(p, LinkOption.NOFOLLOW_LINKS))
                    .filter(p -> p.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(MarkdownRecordWriter.FILE_EXTENSION))
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new IllegalStateException("遍历目录失败：" + source, e);
        }
    }

    private String readText(Path file) {
        long maxBytes = properties.getReadMaxBytes().toBytes();
        byte[] bytes;
        try {
            long size = Files.size(file);
            if (size > maxBytes) {
                throw new IllegalArgumentException("文件超过大小上限（app.md.read-max-bytes=" + maxBytes + "）：" + file);
            }
            bytes = Files.readAllBytes(file);
        } catch (IOException e) {
            throw new IllegalStateException("读取文件失败：" + file, e);
        }
        return decodeUtf8BestEffort(bytes);
    }

    private static String decodeUtf8BestEffort(byte[] bytes) {
        // 非法 UTF-8 字节用替换字符兜底
        var decoder = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPLACE)
                .onUnmappableCharacter(CodingErrorAction.REPLACE);
        try {
            return decoder.decode(ByteBuffer.wrap(bytes)).toString();
        } catch (CharacterCodingException e) {
            return new String(bytes, StandardCharsets.UTF_8);
        }
    }

    private static void writeAtomically(Path target, byte[] bytes) throws IOException {
        // 先写同目录临时文件，再 move 替换（ATOMIC_MOVE 不支持时降级为普通 move）
        Path parent = target.getParent();
        if (parent == null) {
            throw new IllegalArgumentException("目标路径无效：" + target);
        }
        Files.createDirectories(parent);
        Path tmp = Files.createTempFile(parent, "rbxmd-", ".tmp");
        try {
            Files.write(tmp, bytes);
            try {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(tmp);
        }
    }

    /**
     * 分组名清洗后可能重名（如 {@code A/B} 与 {@code A_B}）：追加 {@code -2}、{@code -3}... 直到不冲突。
     * 按小写比较，避免大小写不敏感的文件系统上互相覆盖。
     */
    private static String uniqueFileName(String fileName, Set<String> usedNames) {
        String stem = fileName.substring(0, fileName.length() - MarkdownRecordWriter.FILE_EXTENSION.length());
        String candidate = fileName;
        int n = 2;
        while (!usedNames.add(candidate.toLowerCase(Locale.ROOT))) {
            candidate = stem + "-" + n++ + MarkdownRecordWriter.FILE_EXTENSION;
        }
        return candidate;
    }

    private static int countNodes(List<SceneNode> nodes) {
        int count = 0;
        for (SceneNode node : nodes) {
            count += 1 + countNodes(node.children());
        }
        return count;
    }

    private static String baseName(String fileName) {
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }

    private String displayPath(WorkspacePathResolver.ResolvedPath input, Path file) {
        return normalizeDisplayPath(pathResolver.resolveForWrite(input.rootId(), file.toString()).displayPath());
    }

    private static String normalizeDisplayPath(String path) {
        return path == null ? null : path.replace('\\', '/');
    }
}
