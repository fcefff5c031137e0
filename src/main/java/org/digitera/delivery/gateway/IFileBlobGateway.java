package org.digitera.delivery.gateway;

/**
 * 文件存储（外部服务）
 * 本服务从不直接传输文件内容，只签发短期访问地址
 */
public interface IFileBlobGateway {

    BlobAccessUrl getTemporaryAccessUrl(String fileBlobRef);
}
