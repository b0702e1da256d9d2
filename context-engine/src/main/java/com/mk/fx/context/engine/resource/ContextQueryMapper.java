package com.mk.fx.context.engine.resource;

import com.mk.fx.context.engine.dto.request.ContextRetrievalRequest;
import com.mk.fx.context.engine.model.CachePolicy;
import com.mk.fx.context.engine.model.ContextQuery;
import com.mk.fx.context.engine.model.Dimension;
import com.mk.fx.context.engine.model.Scope;
import java.util.List;
import java.util.stream.Collectors;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.Named;

@Mapper(componentModel = "spring")
public interface ContextQueryMapper {

  @Mapping(target = "scope", source = "scope", qualifiedByName = "mapScope")
  @Mapping(target = "dimensions", source = "includeDimensions", qualifiedByName = "mapDimensions")
  @Mapping(target = "cachePolicy", source = "useCache", qualifiedByName = "mapCachePolicy")
  ContextQuery toQuery(ContextRetrievalRequest request);

  @Named("mapScope")
  default Scope mapScope(String scope) {
    return scope == null ? null : Scope.fromValue(scope);
  }

  @Named("mapDimensions")
  default List<Dimension> mapDimensions(List<String> dimensions) {
    if (dimensions == null) {
      return null;
    }
    return dimensions.stream().map(Dimension::fromValue).distinct().collect(Collectors.toList());
  }

  @Named("mapCachePolicy")
  default CachePolicy mapCachePolicy(Boolean useCache) {
    return CachePolicy.fromUseCache(useCache == null || useCache);
  }
}
