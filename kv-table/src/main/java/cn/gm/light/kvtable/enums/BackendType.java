package cn.gm.light.kvtable.enums;

public enum BackendType {
    // LSM 结构，标识为目录
    ROCKSDB,
    // 嵌入式关系库，标识为数据库文件
    SQLITE,
    // H2 MVStore B-tree 文件
    MVSTORE,
    // 纯内存跳表，关闭即丢弃
    MEMORY,

    ;
}
