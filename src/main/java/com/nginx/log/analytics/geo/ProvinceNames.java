package com.nginx.log.analytics.geo;

import java.util.Map;

import com.google.common.collect.ImmutableMap;

/**
 * Chinese province names in the long form used for grouping and the short form the
 * China map is drawn with.
 */
public final class ProvinceNames {

    public static final String UNKNOWN = "未知";
    public static final String HONG_KONG = "香港特别行政区";
    public static final String MACAO = "澳门特别行政区";
    public static final String TAIWAN = "台湾省";

    private static final Map<String, String> LONG_NAMES = ImmutableMap.<String, String>builder()
            .put("北京", "北京市")
            .put("天津", "天津市")
            .put("上海", "上海市")
            .put("重庆", "重庆市")
            .put("河北", "河北省")
            .put("山西", "山西省")
            .put("辽宁", "辽宁省")
            .put("吉林", "吉林省")
            .put("黑龙江", "黑龙江省")
            .put("江苏", "江苏省")
            .put("浙江", "浙江省")
            .put("安徽", "安徽省")
            .put("福建", "福建省")
            .put("江西", "江西省")
            .put("山东", "山东省")
            .put("河南", "河南省")
            .put("湖北", "湖北省")
            .put("湖南", "湖南省")
            .put("广东", "广东省")
            .put("海南", "海南省")
            .put("四川", "四川省")
            .put("贵州", "贵州省")
            .put("云南", "云南省")
            .put("陕西", "陕西省")
            .put("甘肃", "甘肃省")
            .put("青海", "青海省")
            .put("台湾", "台湾省")
            .put("内蒙古", "内蒙古自治区")
            .put("广西", "广西壮族自治区")
            .put("西藏", "西藏自治区")
            .put("宁夏", "宁夏回族自治区")
            .put("新疆", "新疆维吾尔自治区")
            .build();

    private static final Map<String, String> SHORT_NAMES;

    static {
        ImmutableMap.Builder<String, String> shortNames = ImmutableMap.builder();
        LONG_NAMES.forEach((shortName, longName) -> shortNames.put(longName, shortName));
        shortNames.put(HONG_KONG, "香港");
        shortNames.put(MACAO, "澳门");
        shortNames.put(UNKNOWN, UNKNOWN);
        SHORT_NAMES = shortNames.build();
    }

    private ProvinceNames() {
    }

    /**
     * Long form of a province name. Names that already carry an administrative suffix
     * are kept; anything else is assumed to be a province.
     */
    public static String normalize(String province) {
        if (province == null || province.isEmpty()) {
            return province;
        }
        String longName = LONG_NAMES.get(province);
        if (longName != null) {
            return longName;
        }
        if (province.endsWith("省") || province.endsWith("市") || province.endsWith("自治区")
                || province.endsWith("特别行政区")) {
            return province;
        }
        return province + "省";
    }

    /**
     * Map label for a long-form name; unmapped names are returned unchanged.
     */
    public static String shortName(String longName) {
        return SHORT_NAMES.getOrDefault(longName, longName);
    }
}
