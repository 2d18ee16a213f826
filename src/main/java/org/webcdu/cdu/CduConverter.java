package org.webcdu.cdu;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.webcdu.cdu.dto.BlockDescriptor;
import org.webcdu.cdu.dto.graph.GraphDocument;
import org.webcdu.cdu.generator.CduTextGenerator;
import org.webcdu.cdu.graph.CduGraphProjector;
import org.webcdu.cdu.model.CduDiagram;
import org.webcdu.cdu.parser.ContinuationProfile;
import org.webcdu.cdu.parser.CduBlockAssembler;
import org.webcdu.cdu.parser.CduSection;
import org.webcdu.cdu.parser.CduSectionExtractor;

import java.util.ArrayList;
import java.util.List;

/**
 * CDU 双向转换入口。
 * <ul>
 *   <li>导入：原始文本 -> 段切分 -> 块组装 -> 图投影，得到节点/连线文档。</li>
 *   <li>导出：精简块描述列表 -> CDU 文本。</li>
 * </ul>
 * 每次调用都是对输入的纯变换，不保存任何跨调用状态，可被并发调用。
 */
public class CduConverter {

    private static final Logger log = LoggerFactory.getLogger(CduConverter.class);

    private final Options options;

    public CduConverter() {
        this(Options.defaults());
    }

    public CduConverter(Options options) {
        this.options = options == null ? Options.defaults() : options;
    }

    /**
     * @param sectionMarker       段开始标记（默认 DCDU）
     * @param continuationProfile 续行规则
     * @param maxDiagnostics      单次结果最多返回的诊断条数
     */
    public record Options(String sectionMarker, ContinuationProfile continuationProfile, int maxDiagnostics) {

        public static Options defaults() {
            return new Options(CduSectionExtractor.DEFAULT_MARKER, ContinuationProfile.EXTENDED, 500);
        }
    }

    /**
     * 输入文本中的一张图及其解析诊断。
     */
    public record DiagramRead(int index, CduDiagram diagram, List<CduDiagnostic> diagnostics) {
    }

    /**
     * 导入结果：选中的图、投影后的文档，以及切分/组装/投影三个阶段累积的诊断。
     */
    public record Conversion(int diagramIndex, int diagramCount, CduDiagram diagram, GraphDocument graph,
                             List<CduDiagnostic> diagnostics) {
    }

    /**
     * 解析文本中的全部图。段切分阶段的诊断（被丢弃的段）附在第一张图上；找不到图时返回空列表。
     */
    public List<DiagramRead> readDiagrams(String text) {
        CduSectionExtractor.Extraction extraction = CduSectionExtractor.extract(text, options.sectionMarker());
        List<DiagramRead> result = new ArrayList<>(extraction.sections().size());
        List<CduSection> sections = extraction.sections();
        for (int i = 0; i < sections.size(); i++) {
            CduBlockAssembler.Assembly assembly = CduBlockAssembler.assemble(sections.get(i), options.continuationProfile());
            List<CduDiagnostic> diagnostics = new ArrayList<>();
            if (i == 0) {
                diagnostics.addAll(extraction.diagnostics());
            }
            diagnostics.addAll(assembly.diagnostics());
            if (log.isDebugEnabled()) {
                for (CduDiagnostic diagnostic : diagnostics) {
                    log.debug("图 {} 第 {} 行：{} {}", i, diagnostic.line(), diagnostic.kind(), diagnostic.message());
                }
            }
            result.add(new DiagramRead(i, assembly.diagram(), diagnostics));
        }
        if (sections.isEmpty() && !extraction.diagnostics().isEmpty()) {
            log.debug("未找到完整的图，切分阶段诊断：{}", extraction.diagnostics());
        }
        return result;
    }

    /**
     * 导入第一张图。
     *
     * @throws CduStructureException 输入中没有完整的 DCDU...FIMCDU 段
     */
    public Conversion importText(String text) {
        return importText(text, 0);
    }

    /**
     * 导入指定序号（从 0 开始）的图。
     *
     * @throws CduStructureException 输入中没有完整的 DCDU...FIMCDU 段，或序号越界
     */
    public Conversion importText(String text, int diagramIndex) {
        return importText(text, diagramIndex, List.of());
    }

    /**
     * 导入指定序号的图，并把调用方在读取阶段产生的诊断（截断、字符集）排在最前面，与解析诊断一起只截断一次。
     *
     * @throws CduStructureException 输入中没有完整的 DCDU...FIMCDU 段，或序号越界
     */
    public Conversion importText(String text, int diagramIndex, List<CduDiagnostic> inputDiagnostics) {
        List<DiagramRead> diagrams = readDiagrams(text);
        if (diagrams.isEmpty()) {
            throw new CduStructureException("输入中未找到 " + options.sectionMarker() + "...FIMCDU 段。");
        }
        if (diagramIndex < 0 || diagramIndex >= diagrams.size()) {
            throw new CduStructureException("图序号越界：" + diagramIndex + "（共 " + diagrams.size() + " 张图）");
        }

        DiagramRead selected = diagrams.get(diagramIndex);
        CduGraphProjector.Projection projection = CduGraphProjector.project(selected.diagram());

        List<CduDiagnostic> diagnostics = new ArrayList<>();
        if (inputDiagnostics != null) {
            diagnostics.addAll(inputDiagnostics);
        }
        diagnostics.addAll(selected.diagnostics());
        diagnostics.addAll(projection.diagnostics());

        CduDiagram diagram = selected.diagram();
        log.info("CDU 导入完成：图 {} {}，节点 {}，连线 {}，诊断 {}",
                diagram.getId(), diagram.getName(),
                projection.graph().nodes().size(), projection.graph().edges().size(), diagnostics.size());

        return new Conversion(diagramIndex, diagrams.size(), diagram, projection.graph(),
                CduDiagnostic.limit(diagnostics, options.maxDiagnostics()));
    }

    /**
     * 导出：总是成功，不认识的块类型输出注释行。
     */
    public CduTextGenerator.Generation exportBlocks(List<BlockDescriptor> blocks) {
        CduTextGenerator.Generation generation = CduTextGenerator.generate(blocks);
        log.info("CDU 导出完成：{} 个块，{} 行，诊断 {}",
                blocks == null ? 0 : blocks.size(), generation.lineCount(), generation.diagnostics().size());
        return new CduTextGenerator.Generation(generation.text(), generation.lineCount(),
                CduDiagnostic.limit(generation.diagnostics(), options.maxDiagnostics()));
    }
}
