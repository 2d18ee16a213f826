package org.webcdu.cdu;

/**
 * 结构性错误：输入中找不到完整的 DCDU...FIMCDU 段，或请求的图序号不存在。
 * <p>
 * 这是转换过程中唯一的“硬失败”，由调用方（MCP 工具层）直接返回给客户端。
 */
public class CduStructureException extends IllegalArgumentException {

    public CduStructureException(String message) {
        super(message);
    }
}
