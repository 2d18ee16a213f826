package org.webcdu.cdu;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.unit.DataSize;
import org.springframework.validation.annotation.Validated;
import org.webcdu.cdu.parser.ContinuationProfile;

import java.util.List;

/**
 * CDU 转换 MCP Server 的业务配置（{@code app.cdu.*}）。
 * <p>
 * 重点：
 * <ul>
 *   <li>通过 {@link #roots} 指定允许读取 CDU 文件的根目录白名单。</li>
 *   <li>通过 {@link #readMaxBytes} 控制单次读取的文件大小上限。</li>
 *   <li>通过 {@link #continuationProfile} 选择续行规则（块类型表本身是常量，不可配置）。</li>
 * </ul>
 */
@Validated
@ConfigurationProperties(prefix = "app.cdu")
public class CduServerProperties {

    /**
     * 允许访问的根目录白名单；每个 root 自动分配 {@code rootId}（root0、root1...）。
     */
    @NotNull
    private List<String> roots = List.of(".");

    /**
     * 是否允许访问符号链接/junction（默认不允许，防止路径逃逸）。
     */
    private boolean allowSymlink = false;

    /**
     * 单个 CDU 文件读取的最大字节数（超过则截断，并在诊断中提示）。
     */
    @NotNull
    private DataSize readMaxBytes = DataSize.ofMegabytes(4);

    /**
     * 段开始标记。
     */
    @NotBlank
    private String sectionMarker = "DCDU";

    /**
     * 文件不是合法 UTF-8 时使用的备用字符集。
     * <p>
     * 老 CDU 文件多为单字节编码，使用 ISO-8859-1 可以保证“字符列 = 字节列”，定长字段切片不会错位。
     */
    @NotBlank
    private String fallbackCharset = "ISO-8859-1";

    /**
     * 续行规则：EXTENDED（默认）额外把 FUNCAO、LOGIC、S/HOLD、T/HOLD、SELET2 视为可变续行类型。
     */
    @NotNull
    private ContinuationProfile continuationProfile = ContinuationProfile.EXTENDED;

    /**
     * 单次结果最多返回的诊断条数（上限保护）。
     */
    @Min(1)
    @Max(100_000)
    private int maxDiagnostics = 500;

    public List<String> getRoots() {
        return roots;
    }

    public void setRoots(List<String> roots) {
        this.roots = roots;
    }

    public boolean isAllowSymlink() {
        return allowSymlink;
    }

    public void setAllowSymlink(boolean allowSymlink) {
        this.allowSymlink = allowSymlink;
    }

    public DataSize getReadMaxBytes() {
        return readMaxBytes;
    }

    public void setReadMaxBytes(DataSize readMaxBytes) {
        this.readMaxBytes = readMaxBytes;
    }

    public String getSectionMarker() {
        return sectionMarker;
    }

    public void setSectionMarker(String sectionMarker) {
        this.sectionMarker = sectionMarker;
    }

    public String getFallbackCharset() {
        return fallbackCharset;
    }

    public void setFallbackCharset(String fallbackCharset) {
        this.fallbackCharset = fallbackCharset;
    }

    public ContinuationProfile getContinuationProfile() {
        return continuationProfile;
    }

    public void setContinuationProfile(ContinuationProfile continuationProfile) {
        this.continuationProfile = continuationProfile;
    }

    public int getMaxDiagnostics() {
        return maxDiagnostics;
    }

    public void setMaxDiagnostics(int maxDiagnostics) {
        this.maxDiagnostics = maxDiagnostics;
    }
}
