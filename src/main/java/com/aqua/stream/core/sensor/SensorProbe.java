package com.aqua.stream.core.sensor;

import java.util.Optional;

/**
 * 外部传感器读取接口（温湿度、水温、水位、pH 等）
 * <p>
 * 实现不得向外抛异常，读取失败返回 Optional.empty()
 */
public interface SensorProbe {

    String getName();

    Optional<Double> read();
}
