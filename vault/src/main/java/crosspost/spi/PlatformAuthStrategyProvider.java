package crosspost.spi;

import java.util.List;

/**
 * SPI for components that create platform strategies at runtime, for example
 * from configuration, instead of declaring each one as a CDI bean.
 */
public interface PlatformAuthStrategyProvider {

    /**
     * Return the strategies this provider offers.
     *
     * @return strategies, each with a distinct platform name
     */
    List<PlatformAuthStrategy> strategies();
}
