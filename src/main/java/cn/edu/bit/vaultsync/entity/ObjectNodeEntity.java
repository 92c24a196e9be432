package cn.edu.bit.vaultsync.entity;

/**
 * 对象存储中的一个目录项
 * 对应数据库表: object_node
 *
 * @param id               节点ID，根目录为0
 * @param parentId         父节点ID
 * @param name             名称
 * @param folder           是否为文件夹
 * @param hash             内容 MD5，文件夹为 null
 * @param size             字节数
 * @param mtimeSeconds     源文件修改时间，秒
 * @param uploadTimeMillis 登记时间，毫秒
 */
public record ObjectNodeEntity(long id, long parentId, String name, boolean folder, String hash, long size,
		long mtimeSeconds, long uploadTimeMillis) {

	public static ObjectNodeEntity root() {
		return new ObjectNodeEntity(0, 0, "", true, null, 0, 0, 0);
	}
}
