package com.weixiao.mgit.transport;

import lombok.Value;

/**
 * 远端广告的一条引用：(oid, 引用名)。
 */
@Value
public class AdvertisedRef {
    String oid;
    String name;
}
