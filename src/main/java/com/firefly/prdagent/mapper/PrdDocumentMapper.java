package com.firefly.prdagent.mapper;

import com.firefly.prdagent.entity.PrdDocument;
import java.util.Optional;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

@Mapper
public interface PrdDocumentMapper {

    Optional<PrdDocument> findById(@Param("id") String id);
}
