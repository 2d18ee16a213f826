package org.webcdu.cdu.dto;

import java.util.List;

/**
 * {@code cdu_list_roots} 的返回结果。
 *
 * @param roots 允许访问的根目录白名单
 */
public record AllowedRootsResult(List<AllowedRoot> roots) {
}
