package feed.relay.core;

import cn.hutool.core.util.StrUtil;

public class Config {

    public static final String APP_ENV = StrUtil.blankToDefault(System.getenv("APP_ENV"), "prod");

    public static final String DATA_PATH = StrUtil.blankToDefault(System.getenv("DATA_PATH"), "data");

    public static final String DOWNLOAD_PATH = StrUtil.blankToDefault(System.getenv("DOWNLOAD_PATH"), "Downloads");
}
