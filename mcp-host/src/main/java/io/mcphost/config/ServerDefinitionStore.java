/*
 * Copyright 2024-2024 the original author or authors.
 */

package io.mcphost.config;

import java.util.List;
import java.util.Optional;

/**
 * 服务器定义的存储。监督器只通过此接口读取定义，主机适配器通过它修改定义。
 *
 * <p>
 * 实现必须是线程安全的。方法可能阻塞（例如读写文件），调用方负责把调用放到合适的调度器上。
 */
public interface ServerDefinitionStore {

	/**
	 * 返回全部定义，按插入顺序排列。
	 */
	List<ServerDefinition> listConfigs();

	Optional<ServerDefinition> getConfig(String id);

	/**
	 * 保存一个新定义。
	 * @param config 带有id的新定义
	 * @return 保存后的定义
	 * @throws IllegalArgumentException 如果id已存在
	 */
	ServerDefinition save(ServerDefinition config);

	/**
	 * 替换一个已有定义。
	 * @param config 带有已存在id的定义
	 * @return 更新后的定义
	 * @throws IllegalArgumentException 如果id不存在
	 */
	ServerDefinition update(ServerDefinition config);

	/**
	 * 删除一个定义。
	 * @param config 要删除的定义，按id匹配
	 * @return 定义存在并被删除时返回true
	 */
	boolean delete(ServerDefinition config);

}
