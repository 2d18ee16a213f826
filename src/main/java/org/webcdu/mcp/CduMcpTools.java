package org.webcdu.mcp;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.ai.tool.annotation.ToolParam;
import org.springframework.stereotype.Component;
import org.webcdu.cdu.CduConverter;
import org.webcdu.cdu.CduDiagnostic;
import org.webcdu.cdu.CduServerProperties;
import org.webcdu.cdu.SecurePathResolver;
import org.webcdu.cdu.dto.AllowedRootsResult;
import org.webcdu.cdu.dto.BlockDescriptor;
import org.webcdu.cdu.dto.CduDiagramListResult;
import org.webcdu.cdu.dto.CduDiagramSummary;
import org.webcdu.cdu.dto.CduExportResult;
import org.webcdu.cdu.dto.CduImportResult;
import org.webcdu.cdu.generator.CduTextGenerator;
import org.webcdu.cdu.model.CduDiagram;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * CDU 转换 MCP 工具集合。
 * <p>
 * 提供能力：
 * <ul>
 *   <li>列出根目录白名单（{@code cdu_list_roots}）。</li>
 *   <li>列出 CDU 文件中的全部图（{@code cdu_list_diagrams}）。</li>
 *   <li>CDU 文件/文本 -> 节点连线文档（{@code cdu_import_file}、{@code cdu_import_text}）。</li>
 *   <li>块描述列表 -> CDU 文本（{@code cdu_export_blocks}）。</li>
 * </ul>
 * <p>
 * 错误约定：找不到 DCDU...FIMCDU 段、路径越界、JSON 非法时抛出 {@link IllegalArgumentException}，
 * 由 MCP 框架作为工具错误返回；行级问题只进入结果的 diagnostics，不会让调用失败。
 */
@Component
public class CduMcpTools {

    private static final Logger log = LoggerFactory.getLogger(CduMcpTools.class);

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    private static final TypeReference<List<BlockDescriptor>> BLOCK_LIST = new TypeReference<>() {
    };

    private final CduServerProperties properties;
    private final SecurePathResolver pathResolver;
    private final CduConverter converter;

    public CduMcpTools(CduServerProperties properties, SecurePathResolver pathResolver, CduConverter converter) {
        this.properties = properties;
        this.pathResolver = pathResolver;
        this.converter = converter;
    }

    @Tool(
            name = "cdu_list_roots",
            description = "列出允许读取 CDU 文件的根目录（rootId + path）。"
    )
    public AllowedRootsResult listRoots() {
        return new AllowedRootsResult(pathResolver.listRoots());
    }

    @Tool(
            name = "cdu_list_diagrams",
            description = "列出 CDU 文件中每个 DCDU...FIMCDU 段的图概要（序号、编号、名称、各类块数量、变量、解析诊断）。"
    )
    public CduDiagramListResult listDiagrams(
            @ToolParam(required = false, description = "rootId（可从 cdu_list_roots 获取；为空默认 root0）") String rootId,
            @ToolParam(description = "CDU 文件路径（相对 rootId 或绝对路径）") String path
    ) {
        SecurePathResolver.ResolvedPath resolved = pathResolver.resolveFile(rootId, path);
        List<CduDiagnostic> diagnostics = new ArrayList<>();
        LoadedText loaded = load(resolved.absolutePath(), diagnostics);

        List<CduDiagramSummary> summaries = new ArrayList<>();
        for (CduConverter.DiagramRead read : converter.readDiagrams(loaded.text())) {
            CduDiagram diagram = read.diagram();
            summaries.add(new CduDiagramSummary(
                    read.index(),
                    diagram.getId(),
                    diagram.getName(),
                    diagram.getImports().size(),
                    diagram.getExports().size(),
                    diagram.getEntries().size(),
                    diagram.getBlocks().size(),
                    diagram.getParams().size(),
                    diagram.getDefaults().size(),
                    diagram.variables(),
                    CduDiagnostic.limit(read.diagnostics(), properties.getMaxDiagnostics())
            ));
        }
        log.info("列出 {} 中的图：{} 张", resolved.displayPath(), summaries.size());

        return new CduDiagramListResult(
                resolved.rootId(),
                resolved.displayPath(),
                loaded.truncated(),
                loaded.decodedWith(),
                summaries,
                CduDiagnostic.limit(diagnostics, properties.getMaxDiagnostics())
        );
    }

    /**
     * 导入文件中的一张图。
     * <p>
     * 文件按字节读取（受 {@code app.cdu.read-max-bytes} 限制），合法 UTF-8 直接解码，否则使用备用字符集，
     * 以保证定长列切片按字节对齐。
     */
    @Tool(
            name = "cdu_import_file",
            description = "把 CDU 文件中的一张图（默认第一张）转换为节点/连线 JSON（nodes、edges、drawingData、groupData、parameters），并返回参数表与解析诊断。"
    )
    public CduImportResult importFile(
            @ToolParam(required = false, description = "rootId（可从 cdu_list_roots 获取；为空默认 root0）") String rootId,
            @ToolParam(description = "CDU 文件路径（相对 rootId 或绝对路径）") String path,
            @ToolParam(required = false, description = "图序号，从 0 开始（默认 0，即第一张图；可从 cdu_list_diagrams 获取）") Integer diagramIndex
    ) {
        SecurePathResolver.ResolvedPath resolved = pathResolver.resolveFile(rootId, path);
        List<CduDiagnostic> diagnostics = new ArrayList<>();
        LoadedText loaded = load(resolved.absolutePath(), diagnostics);

        CduConverter.Conversion conversion = converter.importText(loaded.text(),
                diagramIndex == null ? 0 : diagramIndex, diagnostics);
        return toImportResult(resolved.rootId(), resolved.displayPath(), loaded.truncated(), loaded.decodedWith(),
                conversion);
    }

    @Tool(
            name = "cdu_import_text",
            description = "把 CDU 文本中的一张图（默认第一张）转换为节点/连线 JSON，并返回参数表与解析诊断。"
    )
    public CduImportResult importText(
            @ToolParam(description = "CDU 原始文本（包含 DCDU ... FIMCDU 段）") String text,
            @ToolParam(required = false, description = "图序号，从 0 开始（默认 0）") Integer diagramIndex
    ) {
        CduConverter.Conversion conversion = converter.importText(text, diagramIndex == null ? 0 : diagramIndex);
        return toImportResult(null, null, false, null, conversion);
    }

    @Tool(
            name = "cdu_export_blocks",
            description = "把块描述 JSON（数组，或 {\"blocks\": [...]} 对象；元素字段 type/label/vin/vout/parameters）生成 CDU 文本。"
                    + "支持 GAIN、INTEGRATOR、SUM、INPUT、OUTPUT，其他类型输出以 * 开头的注释行。"
    )
    public CduExportResult exportBlocks(
            @ToolParam(description = "块描述 JSON") String blocksJson
    ) {
        List<BlockDescriptor> blocks = parseBlocks(blocksJson);
        CduTextGenerator.Generation generation = converter.exportBlocks(blocks);
        return new CduExportResult(generation.text(), generation.lineCount(), generation.diagnostics());
    }

    private CduImportResult toImportResult(String rootId,
                                           String path,
                                           boolean truncated,
                                           String decodedWith,
                                           CduConverter.Conversion conversion) {
        CduDiagram diagram = conversion.diagram();
        return new CduImportResult(
                rootId,
                path,
                truncated,
                decodedWith,
                conversion.diagramIndex(),
                conversion.diagramCount(),
                diagram.getId(),
                diagram.getName(),
                diagram.getParams(),
                diagram.getDefaults(),
                conversion.graph(),
                conversion.diagnostics()
        );
    }

    static List<BlockDescriptor> parseBlocks(String blocksJson) {
        if (blocksJson == null || blocksJson.isBlank()) {
            return List.of();
        }
        JsonNode root;
        try {
            root = OBJECT_MAPPER.readTree(blocksJson);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("块描述不是合法 JSON：" + e.getOriginalMessage(), e);
        }
        JsonNode array = root;
        if (root != null && root.isObject()) {
            array = root.get("blocks");
        }
        if (array == null || array.isNull()) {
            return List.of();
        }
        if (!array.isArray()) {
            throw new IllegalArgumentException("块描述必须是 JSON 数组，或包含 blocks 数组的对象");
        }
        try {
            return OBJECT_MAPPER.convertValue(array, BLOCK_LIST);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("块描述字段格式不正确：" + e.getMessage(), e);
        }
    }

    private record LoadedText(String text, boolean truncated, String decodedWith) {
    }

    private LoadedText load(Path file, List<CduDiagnostic> diagnostics) {
        long maxBytes = properties.getReadMaxBytes().toBytes();
        long totalBytes;
        try {
            totalBytes = Files.size(file);
        } catch (IOException e) {
            throw new IllegalStateException("读取文件大小失败：" + file, e);
        }
        byte[] bytes = readUpTo(file, maxBytes);
        boolean truncated = totalBytes > bytes.length;
        if (truncated) {
            diagnostics.add(CduDiagnostic.of(CduDiagnostic.Kind.TRUNCATED_INPUT,
                    "文件超过 " + maxBytes + " 字节，只解析了前半部分；可调大 app.cdu.read-max-bytes。"));
        }

        // 截断点可能落在多字节字符中间，丢掉残缺的尾部再按 UTF-8 严格解码
        int length = truncated ? completeUtf8Length(bytes) : bytes.length;
        try {
            String text = StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes, 0, length))
                    .toString();
            return new LoadedText(text, truncated, "utf-8");
        } catch (CharacterCodingException e) {
            // 老 CDU 文件多为单字节编码，按备用字符集解码
            Charset fallback = Charset.forName(properties.getFallbackCharset());
            diagnostics.add(CduDiagnostic.of(CduDiagnostic.Kind.CHARSET,
                    "文件不是有效 UTF-8，已使用 " + fallback.name() + " 解码。"));
            return new LoadedText(new String(bytes, fallback), truncated, fallback.name().toLowerCase(Locale.ROOT));
        }
    }

    /**
     * 返回去掉末尾不完整 UTF-8 序列后的长度；末尾序列完整（或本身就不是合法 UTF-8）时返回原长度。
     */
    static int completeUtf8Length(byte[] bytes) {
        int end = bytes.length;
        int lead = end - 1;
        while (lead >= 0 && end - lead <= 3 && (bytes[lead] & 0xC0) == 0x80) {
            lead--;
        }
        if (lead < 0) {
            return end;
        }
        int first = bytes[lead] & 0xFF;
        int expected;
        if (first >= 0xF0) {
            expected = 4;
        } else if (first >= 0xE0) {
            expected = 3;
        } else if (first >= 0xC0) {
            expected = 2;
        } else {
            expected = 1;
        }
        return end - lead < expected ? lead : end;
    }

    private static byte[] readUpTo(Path file, long maxBytes) {
        // 流式读取：最多读取 maxBytes 字节
        try (InputStream in = Files.newInputStream(file)) {
            ByteArrayOutputStream out = new ByteArrayOutputStream((int) Math.min(maxBytes, 1024 * 1024));
            byte[] buffer = new byte[8192];
            long remaining = maxBytes;
            int read;
            while (remaining > 0 && (read = in.read(buffer, 0, (int) Math.min(buffer.length, remaining))) >= 0) {
                out.write(buffer, 0, read);
                remaining -= read;
            }
            return out.toByteArray();
        } catch (IOException e) {
            throw new IllegalStateException("读取文件失败：" + file, e);
        }
    }
}
