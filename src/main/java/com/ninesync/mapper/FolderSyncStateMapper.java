package com.ninesync.mapper;

import com.ninesync.domain.FolderSyncState;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

@Mapper
public interface FolderSyncStateMapper {

    void upsert(FolderSyncState state);

    FolderSyncState find(@Param("accountId") String accountId, @Param("folderName") String folderName);
}
