package org.docstore.DTO;

// 路径在磁盘上的类型
public enum PathType {
    FILE, DIRECTORY, ABSENT
}
