package com.crescent.gateway.core.dao;

import com.crescent.gateway.core.model.ModelRoute;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Select;

import java.util.List;

@Mapper
public interface ModelRouteMapper {

    @Select("""
        SELECT id, model_name, provider_id, provider_dialect, endpoint_url, api_key,
               upstream_model, max_batch_size, enabled
        FROM model_route
        WHERE enabled = 1
    """)
    List<ModelRoute> findAllEnabled();
}
